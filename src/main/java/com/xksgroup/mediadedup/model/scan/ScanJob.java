package com.xksgroup.mediadedup.model.scan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "scan_jobs")
public class ScanJob {
    @Id
    private String id;

    private String jobId;
    private String collectionId; // null means every collection of the catalog
    private ScanTrigger trigger;
    private ScanJobStatus status;

    // Progress tracking
    private int progressPercentage;
    private String statusMessage;
    private int collectionsTotal;
    private int collectionsScanned;
    private int collectionsFailed;
    private int itemsProcessed;
    private int duplicatesFound;

    // Timestamps
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime lastProgressUpdate;

    // Error information
    private String errorMessage;
}
