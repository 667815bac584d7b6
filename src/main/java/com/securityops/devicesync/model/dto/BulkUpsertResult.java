package com.securityops.devicesync.model.dto;

import java.util.List;

/**
 * Outcome of writing a full set of sync records. Counts are per record, not per batch.
 */
public record BulkUpsertResult(
    int successCount,
    int failureCount,
    double cost,
    long executionTimeMs,
    List<SyncError> errors
) {
    public static BulkUpsertResult empty() {
        return new BulkUpsertResult(0, 0, 0.0, 0L, List.of());
    }
}
