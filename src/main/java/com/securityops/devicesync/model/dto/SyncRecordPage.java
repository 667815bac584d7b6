package com.securityops.devicesync.model.dto;

import com.securityops.devicesync.model.domain.SyncRecord;

import java.util.List;

public record SyncRecordPage(
    List<SyncRecord> records,
    boolean hasMore,
    String continuationToken,
    double cost
) {
    public int count() {
        return records.size();
    }
}
