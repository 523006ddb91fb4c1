package com.xksgroup.mediadedup.service.scan;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.exception.ResourceNotFoundException;
import com.xksgroup.mediadedup.exception.ScanAlreadyRunningException;
import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanJobStatus;
import com.xksgroup.mediadedup.model.scan.ScanTrigger;
import com.xksgroup.mediadedup.repo.ScanJobRepository;
import com.xksgroup.mediadedup.service.DuplicateGroupService;
import com.xksgroup.mediadedup.service.EventService;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanJobServiceTest {

    @Mock
    private ScanJobRepository scanJobRepository;

    @Mock
    private DuplicateScanService duplicateScanService;

    @Mock
    private DuplicateGroupService duplicateGroupService;

    @Mock
    private MediaCatalog catalog;

    @Mock
    private EventService eventService;

    private final ScanLock scanLock = new ScanLock();
    private final DedupProperties properties = new DedupProperties();
    private ScanJobService service;

    @BeforeEach
    void setUp() {
        lenient().when(scanJobRepository.save(any(ScanJob.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new ScanJobService(scanJobRepository, duplicateScanService, duplicateGroupService,
                catalog, scanLock, properties, eventService);
    }

    @Test
    void should_CreatePendingJob() {
        ScanJob job = service.createJob("movies", ScanTrigger.MANUAL);

        assertThat(job.getJobId()).startsWith("scan-");
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.PENDING);
        assertThat(job.getCollectionId()).isEqualTo("movies");
        assertThat(job.getCreatedAt()).isNotNull();
        assertThat(service.isScanRunning()).isTrue();
    }

    @Test
    void should_ScanEveryCollectionAndPersistCompletedOnes() {
        when(catalog.listCollections()).thenReturn(List.of(collection("movies"), collection("shows")));
        DuplicateGroup group = DuplicateGroup.builder().id("g1").build();
        when(duplicateScanService.scanCollection(eq("movies"), any(LibraryPreferences.class), any(CancellationSignal.class)))
                .thenReturn(ScanOutcome.completed("movies", List.of(group), 10, 0));
        when(duplicateScanService.scanCollection(eq("shows"), any(LibraryPreferences.class), any(CancellationSignal.class)))
                .thenReturn(ScanOutcome.failed("shows", ScanOutcome.FailureReason.CATALOG_UNAVAILABLE, "offline"));

        ScanJob job = service.runJob(service.createJob(null, ScanTrigger.MANUAL));

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getCollectionsTotal()).isEqualTo(2);
        assertThat(job.getCollectionsScanned()).isEqualTo(1);
        assertThat(job.getCollectionsFailed()).isEqualTo(1);
        assertThat(job.getItemsProcessed()).isEqualTo(10);
        assertThat(job.getDuplicatesFound()).isEqualTo(1);
        assertThat(job.getProgressPercentage()).isEqualTo(100);
        verify(duplicateGroupService).saveScanResult("movies", job.getJobId(), List.of(group));
        verify(duplicateGroupService, never()).saveScanResult(eq("shows"), anyString(), any());
        verify(eventService).notifyScanCompleted(job);
        assertThat(service.isScanRunning()).isFalse();
        assertThat(scanLock.isHeld()).isFalse();
    }

    @Test
    void should_UseCollectionPreferences() {
        DedupProperties.LibraryOverrides overrides = new DedupProperties.LibraryOverrides();
        overrides.setSimilarityThreshold(90);
        properties.getLibraries().put("movies", overrides);
        LibraryPreferences moviePreferences = LibraryPreferences.builder().similarityThreshold(90).build();
        when(duplicateScanService.scanCollection(eq("movies"), eq(moviePreferences), any(CancellationSignal.class)))
                .thenReturn(ScanOutcome.completed("movies", List.of(), 0, 0));

        ScanJob job = service.runJob(service.createJob("movies", ScanTrigger.MANUAL));

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        verifyNoInteractions(catalog);
    }

    @Test
    void should_FailJob_When_EveryCollectionFails() {
        when(duplicateScanService.scanCollection(eq("movies"), any(LibraryPreferences.class), any(CancellationSignal.class)))
                .thenReturn(ScanOutcome.failed("movies", ScanOutcome.FailureReason.UNEXPECTED_ERROR, "boom"));

        ScanJob job = service.runJob(service.createJob("movies", ScanTrigger.SCHEDULED));

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.FAILED);
        verify(eventService).notifyScanFailed(job);
        verifyNoInteractions(duplicateGroupService);
    }

    @Test
    void should_NotPersistCancelledCollection() {
        when(duplicateScanService.scanCollection(eq("movies"), any(LibraryPreferences.class), any(CancellationSignal.class)))
                .thenAnswer(inv -> {
                    CancellationSignal signal = inv.getArgument(2);
                    signal.cancel();
                    return ScanOutcome.cancelled("movies", 3);
                });

        ScanJob job = service.runJob(service.createJob("movies", ScanTrigger.MANUAL));

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.CANCELLED);
        verifyNoInteractions(duplicateGroupService);
        verify(eventService).notifyScanCancelled(job);
    }

    @Test
    void should_StopBeforeNextCollection_When_CancelRequested() {
        when(catalog.listCollections()).thenReturn(List.of(collection("movies"), collection("shows")));
        ScanJob created = service.createJob(null, ScanTrigger.MANUAL);
        lenient().when(scanJobRepository.findByJobId(created.getJobId())).thenReturn(Optional.of(created));
        when(duplicateScanService.scanCollection(eq("movies"), any(LibraryPreferences.class), any(CancellationSignal.class)))
                .thenAnswer(inv -> {
                    service.cancelJob(created.getJobId());
                    return ScanOutcome.completed("movies", List.of(), 5, 0);
                });

        ScanJob job = service.runJob(created);

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.CANCELLED);
        verify(duplicateScanService, never()).scanCollection(eq("shows"), any(), any());
    }

    @Test
    void should_SkipJob_When_AnotherScanHoldsTheLock() throws Exception {
        ExecutorService other = Executors.newSingleThreadExecutor();
        CompletableFuture<Void> release = new CompletableFuture<>();
        CompletableFuture<Void> acquired = new CompletableFuture<>();
        try {
            other.submit(() -> {
                try (ScanLock.Handle ignored = scanLock.tryAcquire().orElseThrow()) {
                    acquired.complete(null);
                    release.get(5, TimeUnit.SECONDS);
                }
                return null;
            });
            acquired.get(5, TimeUnit.SECONDS);

            ScanJob job = service.runJob(service.createJob("movies", ScanTrigger.SCHEDULED));

            assertThat(job.getStatus()).isEqualTo(ScanJobStatus.SKIPPED);
            verifyNoInteractions(duplicateScanService);
        } finally {
            release.complete(null);
            other.shutdown();
        }
    }

    @Test
    void should_SkipJob_When_DetectionDisabled() {
        properties.setEnabled(false);

        ScanJob job = service.runJob(service.createJob(null, ScanTrigger.SCHEDULED));

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.SKIPPED);
        verifyNoInteractions(duplicateScanService, catalog);
    }

    @Test
    void should_RefuseManualScan_When_OneIsAlreadyRunning() {
        service.createJob(null, ScanTrigger.MANUAL);

        assertThatThrownBy(() -> service.requestManualScan("movies"))
                .isInstanceOf(ScanAlreadyRunningException.class);
    }

    @Test
    void should_NotCancelFinishedJob() {
        ScanJob finished = ScanJob.builder().jobId("scan-1").status(ScanJobStatus.COMPLETED).build();
        when(scanJobRepository.findByJobId("scan-1")).thenReturn(Optional.of(finished));

        assertThat(service.cancelJob("scan-1")).isFalse();
    }

    @Test
    void should_MarkOrphanJobCancelled() {
        ScanJob orphan = ScanJob.builder().jobId("scan-old").status(ScanJobStatus.RUNNING).build();
        when(scanJobRepository.findByJobId("scan-old")).thenReturn(Optional.of(orphan));

        assertThat(service.cancelJob("scan-old")).isTrue();
        assertThat(orphan.getStatus()).isEqualTo(ScanJobStatus.CANCELLED);
        verify(eventService).notifyScanCancelled(orphan);
    }

    @Test
    void should_ThrowNotFound_When_JobUnknown() {
        when(scanJobRepository.findByJobId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getJob("nope")).isInstanceOf(ResourceNotFoundException.class);
    }

    private static MediaCollection collection(String id) {
        return MediaCollection.builder().id(id).name(id).path("/media/" + id).build();
    }
}
