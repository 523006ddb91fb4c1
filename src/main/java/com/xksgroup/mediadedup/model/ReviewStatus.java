package com.xksgroup.mediadedup.model;

public enum ReviewStatus {
    PENDING,    // Detected, nobody looked at it yet
    REVIEWED,   // Primary confirmed by a user
    RESOLVED,   // Lower quality copies handled by the deletion workflow
    IGNORED     // Not a real duplicate, keep all copies
}
