package com.securityops.devicesync.exception;

/**
 * A cross-sync phase failed and the run was aborted.
 * The message carries the phase name and the cause's message.
 */
public class CrossSyncException extends RuntimeException {

    private final String phase;

    public CrossSyncException(String phase, Throwable cause) {
        super("Cross-sync operation failed during " + phase + ": " + cause.getMessage(), cause);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
