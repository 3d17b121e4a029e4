package com.platform.replication.state;

import java.time.Instant;

/**
 * Audit entry for an attempted state transition.
 */
public record TransitionRecord(
    String intent,
    ReplicationState from,
    ReplicationState to,
    String reason,
    String requestId,
    Instant timestamp,
    boolean accepted
) {}
