package com.xksgroup.mediadedup.model.dto;

import com.xksgroup.mediadedup.model.DeletionAuditRecord;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one deletion, reported by whatever executed it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionAuditRequest {

    @NotBlank(message = "groupId is required")
    private String groupId;

    @NotBlank(message = "itemId is required")
    private String itemId;

    @NotBlank(message = "filePath is required")
    private String filePath;

    private int qualityScore;
    private String deletionReason;
    private boolean userInitiated;
    private String userId;
    private boolean success;
    private String errorMessage;

    public DeletionAuditRecord toRecord() {
        return DeletionAuditRecord.builder()
                .groupId(groupId)
                .itemId(itemId)
                .filePath(filePath)
                .qualityScore(qualityScore)
                .deletionReason(deletionReason)
                .userInitiated(userInitiated)
                .userId(userId)
                .success(success)
                .errorMessage(errorMessage)
                .build();
    }
}
