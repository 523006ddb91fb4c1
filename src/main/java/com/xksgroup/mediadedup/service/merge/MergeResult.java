package com.xksgroup.mediadedup.service.merge;

import java.util.List;

/**
 * Outcome of a metadata merge. {@code unresolvedItemIds} lists members skipped because the catalog
 * no longer knows them.
 */
public record MergeResult(Status status, int mergedMembers, List<String> unresolvedItemIds) {

    public enum Status {
        MERGED,
        NO_RESOLVABLE_MEMBERS
    }
}
