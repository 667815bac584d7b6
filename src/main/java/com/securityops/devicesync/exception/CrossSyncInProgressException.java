package com.securityops.devicesync.exception;

public class CrossSyncInProgressException extends RuntimeException {

    public CrossSyncInProgressException(String message) {
        super(message);
    }
}
