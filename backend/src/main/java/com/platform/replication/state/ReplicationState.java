package com.platform.replication.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Unified replication state of a volume pair.
 * Every backend state is translated to and from exactly one of these values.
 *
 * Transitions are validated by ReplicationStateMachine.
 */
public enum ReplicationState {
    /**
     * Volume is the writable side of the pair.
     * Transitions: DEMOTING, SYNCING, FAILED
     */
    SOURCE("source"),

    /**
     * Volume receives data from the source.
     * Transitions: PROMOTING, SYNCING, FAILED
     */
    REPLICA("replica"),

    /**
     * Replica is being promoted to source.
     * Transitions: SOURCE, FAILED
     */
    PROMOTING("promoting"),

    /**
     * Source is being demoted to replica.
     * Transitions: REPLICA, FAILED
     */
    DEMOTING("demoting"),

    /**
     * Pair is resynchronizing.
     * Transitions: SOURCE, REPLICA, FAILED
     */
    SYNCING("syncing"),

    /**
     * Replication is broken and needs recovery.
     * Transitions: SYNCING, SOURCE, REPLICA
     */
    FAILED("failed");

    private final String value;

    ReplicationState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ReplicationState> fromValue(String value) {
        return Arrays.stream(values())
            .filter(s -> s.value.equals(value))
            .findFirst();
    }

    @JsonCreator
    static ReplicationState forJson(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown replication state: " + value));
    }

    /**
     * States that settle on their own once the backend finishes the operation.
     */
    public boolean isTransitional() {
        return this == PROMOTING || this == DEMOTING || this == SYNCING;
    }

    @Override
    public String toString() {
        return value;
    }
}
