package com.xksgroup.mediadedup.service;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.model.DeletionAuditRecord;
import com.xksgroup.mediadedup.repo.DeletionAuditRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-14T10:00:00Z");

    @Mock
    private DeletionAuditRepository auditRepository;

    private final DedupProperties properties = new DedupProperties();
    private AuditService service;

    @BeforeEach
    void setUp() {
        service = new AuditService(auditRepository, properties);
    }

    @Test
    void should_AssignIdTimestampAndMonth() {
        when(auditRepository.insert(any(DeletionAuditRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        Instant before = Instant.now();

        DeletionAuditRecord saved = service.record(DeletionAuditRecord.builder()
                .groupId("g1")
                .itemId("a")
                .filePath("/media/a.mkv")
                .success(true)
                .build());

        assertThat(saved.getId()).isNotBlank();
        assertThat(saved.getTimestamp()).isAfterOrEqualTo(before);
        assertThat(saved.getMonth()).isEqualTo(AuditService.MONTH_FORMAT.format(saved.getTimestamp()));
        assertThat(saved.getMonth()).matches("\\d{4}_\\d{2}");
    }

    @Test
    void should_KeepReportedTimestamp_When_Provided() {
        when(auditRepository.insert(any(DeletionAuditRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        Instant reported = Instant.parse("2026-01-31T23:59:59Z");

        DeletionAuditRecord saved = service.record(DeletionAuditRecord.builder()
                .groupId("g1")
                .itemId("a")
                .timestamp(reported)
                .build());

        assertThat(saved.getTimestamp()).isEqualTo(reported);
        assertThat(saved.getMonth()).isEqualTo("2026_01");
    }

    @Test
    void should_RejectInvertedRange() {
        assertThatThrownBy(() -> service.find(NOW, NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(auditRepository);
    }

    @Test
    void should_PickQueryFromBounds() {
        DeletionAuditRecord record = DeletionAuditRecord.builder().id("r1").build();
        when(auditRepository.findBetween(NOW.minusSeconds(60), NOW)).thenReturn(List.of(record));
        when(auditRepository.findSince(NOW)).thenReturn(List.of());
        when(auditRepository.findAllByOrderByTimestampDesc()).thenReturn(List.of(record));

        assertThat(service.find(NOW.minusSeconds(60), NOW)).containsExactly(record);
        assertThat(service.find(NOW, null)).isEmpty();
        assertThat(service.find(null, null)).containsExactly(record);
    }

    @Test
    void should_PurgeRecordsOlderThanRetention() {
        properties.setAuditRetentionDays(30);
        when(auditRepository.deleteByTimestampBefore(any(Instant.class))).thenReturn(4L);
        Instant before = Instant.now();

        assertThat(service.purgeExpired()).isEqualTo(4L);

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(auditRepository).deleteByTimestampBefore(cutoff.capture());
        assertThat(cutoff.getValue())
                .isAfterOrEqualTo(before.minus(30, ChronoUnit.DAYS))
                .isBeforeOrEqualTo(Instant.now().minus(30, ChronoUnit.DAYS));
    }

    @Test
    void should_NotPurge_When_RetentionDisabled() {
        properties.setAuditRetentionDays(0);

        assertThat(service.purgeExpired()).isZero();
        verifyNoInteractions(auditRepository);
    }
}
