package com.securityops.devicesync.model.dto;

import java.util.List;

/**
 * Outcome of one cross-sync run: state distribution, per-phase timings and costs, and the
 * records that could not be written.
 */
public record CrossSyncResult(
    long matched,
    long onlyIntune,
    long onlyDefender,
    int totalProcessed,
    long executionTimeMs,
    double totalCost,
    long fetchIntuneMs,
    long fetchDefenderMs,
    long matchingMs,
    long clearMs,
    long upsertMs,
    double fetchIntuneCost,
    double fetchDefenderCost,
    double clearCost,
    double upsertCost,
    int deletedCount,
    int successCount,
    int failureCount,
    String syncTimestamp,
    List<SyncError> errors
) {
    public boolean hasFailures() {
        return failureCount > 0;
    }
}
