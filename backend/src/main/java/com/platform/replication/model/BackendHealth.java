package com.platform.replication.model;

/**
 * Health of a backend replication record as reported by its adapter.
 */
public enum BackendHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN
}
