package com.xksgroup.mediadedup.exception;

public class ScanAlreadyRunningException extends RuntimeException {

    public ScanAlreadyRunningException(String message) {
        super(message);
    }
}
