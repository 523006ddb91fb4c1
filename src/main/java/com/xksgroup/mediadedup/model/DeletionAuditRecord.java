package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only trace of one deletion attempt reported by the deletion workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "deletion_audit")
public class DeletionAuditRecord {
    @Id
    private String id;

    private String groupId;
    private String itemId;
    private String filePath;
    private int qualityScore;
    private String deletionReason;
    private boolean userInitiated;
    private String userId;

    @Indexed
    private Instant timestamp;

    private boolean success;
    private String errorMessage;

    // yyyy_MM, records are grouped by month
    @Indexed
    private String month;
}
