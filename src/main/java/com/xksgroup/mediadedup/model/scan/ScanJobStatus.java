package com.xksgroup.mediadedup.model.scan;

public enum ScanJobStatus {
    PENDING,    // Job created, waiting for a worker
    RUNNING,    // Collections are being scanned
    COMPLETED,  // Every collection was processed (some may have failed individually)
    FAILED,     // Job aborted
    CANCELLED,  // Cancelled by a user
    SKIPPED     // Another scan was holding the scan lock
}
