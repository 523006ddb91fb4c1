package com.xksgroup.mediadedup.service.scan;

import com.xksgroup.mediadedup.model.DuplicateGroup;

import java.util.List;

/**
 * Result of scanning one collection. Only {@link Status#COMPLETED} outcomes are meant to be persisted.
 */
public record ScanOutcome(
        String collectionId,
        Status status,
        List<DuplicateGroup> groups,
        int itemsProcessed,
        int groupsDropped,
        FailureReason failureReason,
        String message
) {

    public enum Status {
        COMPLETED,
        CANCELLED,
        FAILED
    }

    public enum FailureReason {
        CATALOG_UNAVAILABLE,
        UNEXPECTED_ERROR
    }

    public static ScanOutcome completed(String collectionId, List<DuplicateGroup> groups, int itemsProcessed, int groupsDropped) {
        return new ScanOutcome(collectionId, Status.COMPLETED, List.copyOf(groups), itemsProcessed, groupsDropped, null, null);
    }

    public static ScanOutcome cancelled(String collectionId, int itemsProcessed) {
        return new ScanOutcome(collectionId, Status.CANCELLED, List.of(), itemsProcessed, 0, null, "Scan cancelled");
    }

    public static ScanOutcome failed(String collectionId, FailureReason reason, String message) {
        return new ScanOutcome(collectionId, Status.FAILED, List.of(), 0, 0, reason, message);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
