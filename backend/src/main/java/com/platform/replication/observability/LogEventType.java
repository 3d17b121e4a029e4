package com.platform.replication.observability;

/**
 * Event types written by StructuredLogger.
 */
public enum LogEventType {
    RECONCILE_STARTED,
    RECONCILE_SUCCEEDED,
    RECONCILE_FAILED,
    RECONCILE_TIMED_OUT,
    BACKEND_SELECTED,
    TRANSITION_ACCEPTED,
    TRANSITION_REJECTED,
    CLEANUP_COMPLETED,
    CLEANUP_FAILED,
    CIRCUIT_BREAKER_STATE_CHANGED,
    DISCOVERY_COMPLETED,
    DISCOVERY_PROBE_FAILED
}
