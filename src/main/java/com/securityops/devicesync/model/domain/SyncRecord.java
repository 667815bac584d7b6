package com.securityops.devicesync.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.ManagedDevice;

import java.util.UUID;

/**
 * One cross-matched device as persisted in the sync store.
 *
 * The payload of a source the device was not found in is absent (null and omitted from JSON),
 * never an empty object. The compact constructor rejects records whose payloads disagree with
 * their state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncRecord(
    String id,
    String syncKey,
    SyncState syncState,
    String syncTimestamp,
    ManagedDevice intune,
    DefenderDevice defender
) {

    public SyncRecord {
        requireText(id, "id");
        requireText(syncKey, "syncKey");
        requireText(syncTimestamp, "syncTimestamp");
        if (syncState == null) {
            throw new IllegalArgumentException("syncState is required");
        }
        boolean consistent = switch (syncState) {
            case MATCHED -> intune != null && defender != null;
            case ONLY_INTUNE -> intune != null && defender == null;
            case ONLY_DEFENDER -> intune == null && defender != null;
        };
        if (!consistent) {
            throw new IllegalArgumentException("Payloads do not match sync state " + syncState.getValue()
                    + " for syncKey " + syncKey);
        }
    }

    public static SyncRecord matched(String syncKey, String syncTimestamp, ManagedDevice intune, DefenderDevice defender) {
        return new SyncRecord(newId(), syncKey, SyncState.MATCHED, syncTimestamp, intune, defender);
    }

    public static SyncRecord onlyIntune(String syncKey, String syncTimestamp, ManagedDevice intune) {
        return new SyncRecord(newId(), syncKey, SyncState.ONLY_INTUNE, syncTimestamp, intune, null);
    }

    public static SyncRecord onlyDefender(String syncKey, String syncTimestamp, DefenderDevice defender) {
        return new SyncRecord(newId(), syncKey, SyncState.ONLY_DEFENDER, syncTimestamp, null, defender);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
    }
}
