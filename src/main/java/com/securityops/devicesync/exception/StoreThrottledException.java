package com.securityops.devicesync.exception;

/**
 * The sync store refused a request because its throughput limit was reached.
 * Callers may retry after a delay.
 */
public class StoreThrottledException extends RuntimeException {

    public StoreThrottledException(String message) {
        super(message);
    }

    public StoreThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
