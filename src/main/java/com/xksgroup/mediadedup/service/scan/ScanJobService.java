package com.xksgroup.mediadedup.service.scan;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.exception.ResourceNotFoundException;
import com.xksgroup.mediadedup.exception.ScanAlreadyRunningException;
import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanJobStatus;
import com.xksgroup.mediadedup.model.scan.ScanTrigger;
import com.xksgroup.mediadedup.repo.ScanJobRepository;
import com.xksgroup.mediadedup.service.DuplicateGroupService;
import com.xksgroup.mediadedup.service.EventService;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Lifecycle of scan jobs: creation, execution under the scan lock, progress tracking and cancellation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanJobService {

    private final ScanJobRepository scanJobRepository;
    private final DuplicateScanService duplicateScanService;
    private final DuplicateGroupService duplicateGroupService;
    private final MediaCatalog catalog;
    private final ScanLock scanLock;
    private final DedupProperties properties;
    private final EventService eventService;

    // Cancellation signals of jobs created by this instance and not finished yet
    private final Map<String, CancellationSignal> activeSignals = new ConcurrentHashMap<>();

    /**
     * Create a new job and return immediately
     */
    public ScanJob createJob(String collectionId, ScanTrigger trigger) {
        String jobId = "scan-" + UUID.randomUUID();

        ScanJob job = ScanJob.builder()
                .jobId(jobId)
                .collectionId(collectionId == null || collectionId.isBlank() ? null : collectionId)
                .trigger(trigger)
                .status(ScanJobStatus.PENDING)
                .statusMessage("Waiting for a worker")
                .progressPercentage(0)
                .createdAt(LocalDateTime.now())
                .lastProgressUpdate(LocalDateTime.now())
                .build();

        ScanJob saved = scanJobRepository.save(job);
        activeSignals.put(jobId, new CancellationSignal());
        log.info("Created {} scan job {} for {}", trigger, jobId,
                saved.getCollectionId() == null ? "all collections" : "collection " + saved.getCollectionId());
        return saved;
    }

    /**
     * Creates a manual job, refusing when a scan is already pending or running.
     */
    public ScanJob requestManualScan(String collectionId) {
        if (isScanRunning()) {
            throw new ScanAlreadyRunningException("A duplicate scan is already running");
        }
        return createJob(collectionId, ScanTrigger.MANUAL);
    }

    public boolean isScanRunning() {
        return scanLock.isHeld() || !activeSignals.isEmpty();
    }

    /**
     * Process job asynchronously
     */
    @Async("taskExecutor")
    public void runJobAsync(ScanJob job) {
        runJob(job);
    }

    /**
     * Runs a job on the calling thread. Collections are scanned one after another; only completed
     * collections replace their stored duplicate groups.
     */
    public ScanJob runJob(ScanJob job) {
        String jobId = job.getJobId();
        CancellationSignal signal = activeSignals.computeIfAbsent(jobId, id -> new CancellationSignal());
        try {
            Optional<ScanLock.Handle> handle = scanLock.tryAcquire();
            if (handle.isEmpty()) {
                log.warn("Scan job {} skipped, another scan holds the scan lock", jobId);
                return finish(job, ScanJobStatus.SKIPPED, "Another scan is already running");
            }
            try (ScanLock.Handle ignored = handle.get()) {
                return execute(job, signal);
            }
        } catch (RuntimeException e) {
            log.error("Failed to process scan job: {} - Error: {}", jobId, e.getMessage(), e);
            job.setErrorMessage(e.getMessage());
            return finish(job, ScanJobStatus.FAILED, "Scan failed");
        } finally {
            activeSignals.remove(jobId);
        }
    }

    private ScanJob execute(ScanJob job, CancellationSignal signal) {
        if (!properties.isEnabled()) {
            log.info("Duplicate detection is disabled, skipping scan job {}", job.getJobId());
            return finish(job, ScanJobStatus.SKIPPED, "Duplicate detection is disabled");
        }
        if (signal.isCancelled()) {
            return finish(job, ScanJobStatus.CANCELLED, "Scan cancelled");
        }

        List<String> collectionIds = collectionsToScan(job);
        job.setStatus(ScanJobStatus.RUNNING);
        job.setStartedAt(LocalDateTime.now());
        job.setCollectionsTotal(collectionIds.size());
        job.setStatusMessage("Scanning " + collectionIds.size() + " collection(s)");
        save(job);
        eventService.dispatchScanProgress();
        log.info("Scan job {} started over {} collection(s)", job.getJobId(), collectionIds.size());

        for (String collectionId : collectionIds) {
            if (signal.isCancelled()) {
                break;
            }

            ScanOutcome outcome = duplicateScanService.scanCollection(
                    collectionId, properties.preferencesFor(collectionId), signal);

            switch (outcome.status()) {
                case COMPLETED -> {
                    duplicateGroupService.saveScanResult(collectionId, job.getJobId(), outcome.groups());
                    job.setCollectionsScanned(job.getCollectionsScanned() + 1);
                    job.setItemsProcessed(job.getItemsProcessed() + outcome.itemsProcessed());
                    job.setDuplicatesFound(job.getDuplicatesFound() + outcome.groups().size());
                }
                case FAILED -> {
                    log.error("Collection {} failed during scan job {} ({}): {}", collectionId, job.getJobId(),
                            outcome.failureReason(), outcome.message());
                    job.setCollectionsFailed(job.getCollectionsFailed() + 1);
                }
                case CANCELLED -> log.info("Collection {} scan cancelled, previous results kept", collectionId);
            }
            updateProgress(job);
        }

        if (signal.isCancelled()) {
            return finish(job, ScanJobStatus.CANCELLED, "Scan cancelled");
        }

        String message = String.format("%d collection(s) scanned, %d failed, %d duplicate group(s) found",
                job.getCollectionsScanned(), job.getCollectionsFailed(), job.getDuplicatesFound());
        if (job.getCollectionsFailed() > 0 && job.getCollectionsFailed() == job.getCollectionsTotal()) {
            job.setErrorMessage("Every collection failed");
            return finish(job, ScanJobStatus.FAILED, message);
        }
        return finish(job, ScanJobStatus.COMPLETED, message);
    }

    private List<String> collectionsToScan(ScanJob job) {
        if (job.getCollectionId() != null) {
            return List.of(job.getCollectionId());
        }
        return catalog.listCollections().stream()
                .map(MediaCollection::getId)
                .collect(Collectors.toList());
    }

    private void updateProgress(ScanJob job) {
        int done = job.getCollectionsScanned() + job.getCollectionsFailed();
        if (job.getCollectionsTotal() > 0) {
            job.setProgressPercentage(done * 100 / job.getCollectionsTotal());
        }
        job.setStatusMessage(String.format("Scanned %d/%d collection(s)", done, job.getCollectionsTotal()));
        job.setLastProgressUpdate(LocalDateTime.now());
        save(job);
        eventService.dispatchScanProgress();
    }

    private ScanJob finish(ScanJob job, ScanJobStatus status, String message) {
        ScanJobStatus previous = job.getStatus();
        job.setStatus(status);
        job.setStatusMessage(message);
        job.setCompletedAt(LocalDateTime.now());
        job.setLastProgressUpdate(LocalDateTime.now());
        if (status == ScanJobStatus.COMPLETED) {
            job.setProgressPercentage(100);
        }
        ScanJob saved = save(job);

        switch (status) {
            case COMPLETED -> eventService.notifyScanCompleted(saved);
            case FAILED -> eventService.notifyScanFailed(saved);
            case CANCELLED -> eventService.notifyScanCancelled(saved);
            default -> eventService.dispatchScanProgress();
        }
        log.info("Updated scan job {} status from {} to: {} ({})", job.getJobId(), previous, status, message);
        return saved;
    }

    private ScanJob save(ScanJob job) {
        return scanJobRepository.save(job);
    }

    /**
     * Requests cancellation of a pending or running job. The job stops between groups and its
     * current collection keeps its previous results.
     */
    public boolean cancelJob(String jobId) {
        ScanJob job = getJob(jobId);
        if (job.getStatus() != ScanJobStatus.PENDING && job.getStatus() != ScanJobStatus.RUNNING) {
            log.warn("Cannot cancel scan job {} - already in final state: {}", jobId, job.getStatus());
            return false;
        }
        CancellationSignal signal = activeSignals.get(jobId);
        if (signal == null) {
            // Left over by a previous instance, nothing runs it anymore
            log.warn("Scan job {} has no running worker, marking it cancelled", jobId);
            finish(job, ScanJobStatus.CANCELLED, "Scan cancelled");
            return true;
        }
        signal.cancel();
        log.info("Cancellation requested for scan job {}", jobId);
        return true;
    }

    public ScanJob getJob(String jobId) {
        return scanJobRepository.findByJobId(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("No scan job found with ID: " + jobId));
    }

    public Page<ScanJob> listJobs(ScanJobStatus status, Pageable pageable) {
        if (status != null) {
            return scanJobRepository.findByStatus(status, pageable);
        }
        return scanJobRepository.findAllByOrderByCreatedAtDesc(pageable);
    }
}
