package com.securityops.devicesync.model.dto;

/**
 * A record that could not be written, keyed by its sync key.
 */
public record SyncError(
    String syncKey,
    String error
) {}
