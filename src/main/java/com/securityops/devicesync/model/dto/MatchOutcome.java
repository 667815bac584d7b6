package com.securityops.devicesync.model.dto;

import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncState;

import java.util.List;

/**
 * Sync records produced by one matching pass, all stamped with {@code syncTimestamp}.
 */
public record MatchOutcome(
    String syncTimestamp,
    List<SyncRecord> records
) {
    public long count(SyncState state) {
        return records.stream().filter(r -> r.syncState() == state).count();
    }
}
