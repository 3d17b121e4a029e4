package com.platform.replication.model;

import java.time.Instant;

/**
 * A single observed condition. Conditions are unique per type within a status.
 */
public record Condition(
    String type,
    ConditionStatus status,
    String reason,
    String message,
    Instant lastTransitionTime
) {
    public static final String READY = "Ready";
    public static final String SYNCED = "Synced";

    public static Condition ready(boolean ready, String reason, String message, Instant now) {
        return new Condition(READY, ConditionStatus.of(ready), reason, message, now);
    }

    public static Condition synced(boolean synced, String reason, String message, Instant now) {
        return new Condition(SYNCED, ConditionStatus.of(synced), reason, message, now);
    }

    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }

    Condition withTransitionTime(Instant time) {
        return new Condition(type, status, reason, message, time);
    }
}
