package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of at least two files judged to be the same title, with their ranking and merged metadata.
 * Embedded in {@link CollectionDuplicates}, never stored on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateGroup {
    private String id;
    private String collectionId;
    private String primaryVersionId;

    // true once a user picked the primary, the quality scorer then leaves it alone
    private boolean primaryManuallySelected;

    @Builder.Default
    private List<VersionRecord> versions = new ArrayList<>();

    @Builder.Default
    private MergedMetadata mergedMetadata = new MergedMetadata();

    private Instant detectedAt;
    private Instant lastReviewedAt;

    @Builder.Default
    private ReviewStatus status = ReviewStatus.PENDING;

    public boolean containsItem(String itemId) {
        if (itemId == null) {
            return false;
        }
        return versions.stream().anyMatch(v -> itemId.equals(v.getItemId()));
    }

    public long distinctItemCount() {
        return versions.stream().map(VersionRecord::getItemId).distinct().count();
    }
}
