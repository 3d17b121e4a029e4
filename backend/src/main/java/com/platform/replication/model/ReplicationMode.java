package com.platform.replication.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Unified replication mode.
 */
public enum ReplicationMode {
    SYNCHRONOUS("synchronous"),
    ASYNCHRONOUS("asynchronous"),
    /**
     * Accepted by the intent model, but no supported backend has a native mapping for it.
     */
    EVENTUAL("eventual");

    private final String value;

    ReplicationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ReplicationMode> fromValue(String value) {
        return Arrays.stream(values())
            .filter(m -> m.value.equals(value))
            .findFirst();
    }

    @JsonCreator
    static ReplicationMode forJson(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown replication mode: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
