package com.xksgroup.mediadedup.scheduler;

import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanTrigger;
import com.xksgroup.mediadedup.service.AuditService;
import com.xksgroup.mediadedup.service.scan.ScanJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ScanScheduler {

    private final ScanJobService scanJobService;
    private final AuditService auditService;

    /**
     * Automatic scan of every collection. Disabled unless {@code dedup.scan.cron} is set.
     */
    @Scheduled(cron = "${dedup.scan.cron:-}")
    public void scheduledScan() {
        if (scanJobService.isScanRunning()) {
            log.info("Scheduled duplicate scan skipped, a scan is already running");
            return;
        }
        ScanJob job = scanJobService.createJob(null, ScanTrigger.SCHEDULED);
        scanJobService.runJob(job);
    }

    @Scheduled(cron = "${dedup.audit-purge-cron:0 30 3 * * *}")
    public void purgeAuditLog() {
        long removed = auditService.purgeExpired();
        if (removed > 0) {
            log.info("Purged {} expired deletion audit records", removed);
        }
    }
}
