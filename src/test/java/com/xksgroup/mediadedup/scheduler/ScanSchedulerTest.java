package com.xksgroup.mediadedup.scheduler;

import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanTrigger;
import com.xksgroup.mediadedup.service.AuditService;
import com.xksgroup.mediadedup.service.scan.ScanJobService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanSchedulerTest {

    @Mock
    private ScanJobService scanJobService;

    @Mock
    private AuditService auditService;

    @InjectMocks
    private ScanScheduler scheduler;

    @Test
    void should_RunScheduledScanOverEveryCollection() {
        ScanJob job = ScanJob.builder().jobId("scan-1").build();
        when(scanJobService.isScanRunning()).thenReturn(false);
        when(scanJobService.createJob(null, ScanTrigger.SCHEDULED)).thenReturn(job);

        scheduler.scheduledScan();

        verify(scanJobService).runJob(job);
    }

    @Test
    void should_SkipScheduledScan_When_ScanRunning() {
        when(scanJobService.isScanRunning()).thenReturn(true);

        scheduler.scheduledScan();

        verify(scanJobService, never()).createJob(any(), any());
        verify(scanJobService, never()).runJob(any());
    }

    @Test
    void should_PurgeExpiredAuditRecords() {
        when(auditService.purgeExpired()).thenReturn(2L);

        scheduler.purgeAuditLog();

        verify(auditService).purgeExpired();
    }
}
