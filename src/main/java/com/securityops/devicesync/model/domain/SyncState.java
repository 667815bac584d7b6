package com.securityops.devicesync.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which source catalog(s) a synced device was found in.
 */
public enum SyncState {
    MATCHED("matched"),
    ONLY_INTUNE("only_intune"),
    ONLY_DEFENDER("only_defender");

    private final String value;

    SyncState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<SyncState> fromValue(String value) {
        return Arrays.stream(values())
                .filter(state -> state.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static SyncState parse(String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sync state: " + value));
    }
}
