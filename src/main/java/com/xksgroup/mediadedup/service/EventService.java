package com.xksgroup.mediadedup.service;

import com.xksgroup.mediadedup.model.dto.ScanJobDto;
import com.xksgroup.mediadedup.model.dto.ScanSubscriber;
import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.repo.ScanJobRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Pushes scan job progress to Server-Sent Events subscribers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    public static final String EVENT_SCAN_UPDATE = "scan-update";
    public static final String EVENT_SCAN_COMPLETED = "scan-completed";
    public static final String EVENT_SCAN_FAILED = "scan-failed";
    public static final String EVENT_SCAN_CANCELLED = "scan-cancelled";

    private final Map<String, ScanSubscriber> subscribers = new ConcurrentHashMap<>();
    private final ScanJobRepository scanJobRepository;

    // Throttling of progress broadcasts
    private static final long DISPATCH_COOLDOWN_MS = 2000;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final AtomicBoolean cooldownActive = new AtomicBoolean(false);
    private final AtomicBoolean pendingUpdate = new AtomicBoolean(false);

    /**
     * Opens a stream for one client. With a job id only that job's events are sent to it.
     */
    public SseEmitter subscribe(String jobId) {
        String subscriberId = UUID.randomUUID().toString();
        SseEmitter emitter = new SseEmitter(0L);
        subscribers.put(subscriberId, ScanSubscriber.builder().sseEmitter(emitter).jobId(jobId).build());

        Runnable cleanup = () -> subscribers.remove(subscriberId);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(t -> cleanup.run());

        safeSend(emitter, "connected", Map.of("ok", true));
        log.debug("SSE subscriber {} connected (job filter: '{}')", subscriberId, jobId);
        return emitter;
    }

    /**
     * Smart-throttled broadcast of active scan jobs:
     * sends immediately when no cooldown is running, otherwise once more when it ends.
     */
    public void dispatchScanProgress() {
        if (cooldownActive.compareAndSet(false, true)) {
            doDispatch();

            scheduler.schedule(() -> {
                cooldownActive.set(false);
                if (pendingUpdate.getAndSet(false)) {
                    dispatchScanProgress();
                }
            }, DISPATCH_COOLDOWN_MS, TimeUnit.MILLISECONDS);
        } else {
            pendingUpdate.set(true);
        }
    }

    private void doDispatch() {
        if (subscribers.isEmpty()) {
            return;
        }
        List<ScanJobDto> active = scanJobRepository.findActiveJobs().stream()
                .map(ScanJobDto::fromJob)
                .collect(Collectors.toList());

        subscribers.forEach((id, subscriber) -> {
            List<ScanJobDto> visible = isWatchingAll(subscriber)
                    ? active
                    : active.stream().filter(dto -> subscriber.getJobId().equals(dto.getJobId())).collect(Collectors.toList());
            safeSend(subscriber.getSseEmitter(), EVENT_SCAN_UPDATE, visible);
        });
    }

    public void notifyScanCompleted(ScanJob job) {
        notifyWatchers(EVENT_SCAN_COMPLETED, job);
    }

    public void notifyScanFailed(ScanJob job) {
        notifyWatchers(EVENT_SCAN_FAILED, job);
    }

    public void notifyScanCancelled(ScanJob job) {
        notifyWatchers(EVENT_SCAN_CANCELLED, job);
    }

    private void notifyWatchers(String eventName, ScanJob job) {
        ScanJobDto dto = ScanJobDto.fromJob(job);
        subscribers.forEach((id, subscriber) -> {
            if (isWatchingAll(subscriber) || job.getJobId().equals(subscriber.getJobId())) {
                safeSend(subscriber.getSseEmitter(), eventName, dto);
            }
        });
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private boolean isWatchingAll(ScanSubscriber subscriber) {
        return subscriber.getJobId() == null || subscriber.getJobId().isBlank();
    }

    /**
     * Sends an event, dropping the subscriber when the connection is gone.
     */
    private void safeSend(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(eventName)
                    .data(data)
                    .reconnectTime(3000));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE subscriber after send failure: {}", e.getMessage());
            try {
                emitter.completeWithError(e);
            } catch (IllegalStateException alreadyCompleted) {
                log.trace("Emitter already completed");
            }
            subscribers.entrySet().removeIf(en -> en.getValue().getSseEmitter() == emitter);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
