package com.platform.replication.error;

import com.platform.replication.state.ReplicationState;

/**
 * Requested state change is not an edge of the transition graph.
 */
public class InvalidTransitionException extends ControlPlaneException {

    private final ReplicationState from;
    private final ReplicationState to;

    public InvalidTransitionException(ReplicationState from, ReplicationState to) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
            String.format("Transition %s -> %s is not allowed", from, to));
        this.from = from;
        this.to = to;
    }

    public ReplicationState getFrom() {
        return from;
    }

    public ReplicationState getTo() {
        return to;
    }
}
