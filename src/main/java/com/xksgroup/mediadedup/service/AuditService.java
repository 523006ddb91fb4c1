package com.xksgroup.mediadedup.service;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.model.DeletionAuditRecord;
import com.xksgroup.mediadedup.repo.DeletionAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of deletion audit records reported by the deletion workflow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy_MM").withZone(ZoneOffset.UTC);

    private final DeletionAuditRepository auditRepository;
    private final DedupProperties properties;

    /**
     * Appends a record. Id, timestamp and month are assigned here, a record is never updated afterwards.
     */
    public DeletionAuditRecord record(DeletionAuditRecord record) {
        Instant now = Instant.now();
        record.setId(UUID.randomUUID().toString());
        if (record.getTimestamp() == null) {
            record.setTimestamp(now);
        }
        record.setMonth(MONTH_FORMAT.format(record.getTimestamp()));

        DeletionAuditRecord saved = auditRepository.insert(record);
        log.info("Logged deletion audit for item {} (group {}, success: {})",
                record.getItemId(), record.getGroupId(), record.isSuccess());
        return saved;
    }

    /**
     * Records between the optional bounds (inclusive), newest first.
     */
    public List<DeletionAuditRecord> find(Instant from, Instant to) {
        if (from != null && to != null) {
            if (from.isAfter(to)) {
                throw new IllegalArgumentException("'from' must not be after 'to'");
            }
            return auditRepository.findBetween(from, to);
        }
        if (from != null) {
            return auditRepository.findSince(from);
        }
        if (to != null) {
            return auditRepository.findUntil(to);
        }
        return auditRepository.findAllByOrderByTimestampDesc();
    }

    public List<DeletionAuditRecord> findByMonth(String month) {
        return auditRepository.findByMonthOrderByTimestampDesc(month);
    }

    /**
     * Deletes records older than the configured retention.
     *
     * @return number of purged records
     */
    public long purgeExpired() {
        int retentionDays = properties.getAuditRetentionDays();
        if (retentionDays <= 0) {
            log.debug("Audit retention disabled, nothing purged");
            return 0;
        }
        Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
        long purged = auditRepository.deleteByTimestampBefore(cutoff);
        log.info("Purged {} deletion audit records older than {}", purged, cutoff);
        return purged;
    }
}
