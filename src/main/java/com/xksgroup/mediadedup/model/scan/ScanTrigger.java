package com.xksgroup.mediadedup.model.scan;

public enum ScanTrigger {
    MANUAL,
    SCHEDULED
}
