package com.platform.replication.connectors;

import com.platform.replication.model.BackendHealth;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.state.ReplicationState;

import java.time.Instant;

/**
 * Observed replication status in unified terms. State and mode are null when the backend
 * reports a token outside the translation tables.
 */
public record AdapterStatus(
    ReplicationState state,
    ReplicationMode mode,
    BackendHealth health,
    Instant lastSyncTime,
    String message
) {
}
