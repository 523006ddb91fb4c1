package com.xksgroup.mediadedup.model.dto;

import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanJobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Client view of a scan job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanJobDto {

    private String jobId;
    private String collectionId;
    private String trigger;

    // Status & Progress
    private String status;
    private String statusMessage;
    private int progressPercentage;

    // Counters
    private int collectionsTotal;
    private int collectionsScanned;
    private int collectionsFailed;
    private int itemsProcessed;
    private int duplicatesFound;

    // Timing
    private String createdAt;
    private String startedAt;
    private String completedAt;
    private String lastUpdate;

    private String errorMessage;

    public static ScanJobDto fromJob(ScanJob job) {
        return ScanJobDto.builder()
                .jobId(job.getJobId())
                .collectionId(job.getCollectionId())
                .trigger(job.getTrigger() != null ? job.getTrigger().name().toLowerCase() : null)

                .status(mapStatus(job.getStatus()))
                .statusMessage(job.getStatusMessage())
                .progressPercentage(job.getProgressPercentage())

                .collectionsTotal(job.getCollectionsTotal())
                .collectionsScanned(job.getCollectionsScanned())
                .collectionsFailed(job.getCollectionsFailed())
                .itemsProcessed(job.getItemsProcessed())
                .duplicatesFound(job.getDuplicatesFound())

                .createdAt(formatDateTime(job.getCreatedAt()))
                .startedAt(formatDateTime(job.getStartedAt()))
                .completedAt(formatDateTime(job.getCompletedAt()))
                .lastUpdate(formatDateTime(job.getLastProgressUpdate()))

                .errorMessage(job.getErrorMessage())
                .build();
    }

    private static String mapStatus(ScanJobStatus status) {
        if (status == null) return "unknown";

        return switch (status) {
            case PENDING -> "waiting";
            case RUNNING -> "scanning";
            case COMPLETED -> "completed";
            case FAILED -> "failed";
            case CANCELLED -> "cancelled";
            case SKIPPED -> "skipped";
        };
    }

    private static String formatDateTime(LocalDateTime dateTime) {
        if (dateTime == null) return null;
        return dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
