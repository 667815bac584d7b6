package com.securityops.devicesync.exception;

/**
 * A source catalog could not be read completely. Aborts the cross-sync run.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
