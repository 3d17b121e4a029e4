package com.platform.replication.state;

import com.platform.replication.error.InvalidTransitionException;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates replication state transitions and keeps a bounded audit trail of them.
 * Validation is pure and never blocks; only the history is shared.
 */
@Slf4j
@Component
public class ReplicationStateMachine {

    public static final String REASON_REJECTED = "rejected";

    // Valid state transitions (from -> to); staying in the same state is always allowed
    private static final Map<ReplicationState, Set<ReplicationState>> ALLOWED_TRANSITIONS = Map.of(
        ReplicationState.SOURCE, Set.of(ReplicationState.DEMOTING, ReplicationState.SYNCING, ReplicationState.FAILED),
        ReplicationState.REPLICA, Set.of(ReplicationState.PROMOTING, ReplicationState.SYNCING, ReplicationState.FAILED),
        ReplicationState.PROMOTING, Set.of(ReplicationState.SOURCE, ReplicationState.FAILED),
        ReplicationState.DEMOTING, Set.of(ReplicationState.REPLICA, ReplicationState.FAILED),
        ReplicationState.SYNCING, Set.of(ReplicationState.SOURCE, ReplicationState.REPLICA, ReplicationState.FAILED),
        ReplicationState.FAILED, Set.of(ReplicationState.SYNCING, ReplicationState.SOURCE, ReplicationState.REPLICA)
    );

    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final TransitionHistory history;

    public ReplicationStateMachine(
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${replication.state-machine.history-size:100}") int historySize) {
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.history = new TransitionHistory(historySize);
    }

    /**
     * Checks if a state transition is valid. An intent with no observed state yet may enter any state.
     */
    public boolean isTransitionAllowed(ReplicationState from, ReplicationState to) {
        if (from == null || from == to) {
            return true;
        }
        Set<ReplicationState> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }

    /**
     * Pure validation without recording.
     *
     * @throws InvalidTransitionException if the edge is not in the graph
     */
    public RequiredOperation validateTransition(ReplicationState from, ReplicationState to) {
        if (!isTransitionAllowed(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        return requiredOperation(from, to);
    }

    /**
     * Validates a transition requested for an intent. A rejection is recorded in the history
     * before the exception is thrown.
     */
    public RequiredOperation requestTransition(String intent, ReplicationState from, ReplicationState to, String requestId) {
        if (!isTransitionAllowed(from, to)) {
            log.warn("Invalid state transition rejected: {} -> {} for {}", from, to, intent);
            append(intent, from, to, REASON_REJECTED, requestId, false);
            throw new InvalidTransitionException(from, to);
        }
        return requiredOperation(from, to);
    }

    /**
     * Records a transition that has been carried out on the backend.
     */
    public void recordTransition(String intent, ReplicationState from, ReplicationState to, String reason, String requestId) {
        log.info("State transition: {} -> {} for {} (reason: {})", from, to, intent, reason);
        append(intent, from, to, reason, requestId, true);
    }

    public RequiredOperation requiredOperation(ReplicationState from, ReplicationState to) {
        if (from == to) {
            return RequiredOperation.ENSURE;
        }
        if (from == ReplicationState.REPLICA && to == ReplicationState.PROMOTING) {
            return RequiredOperation.PROMOTE;
        }
        if (from == ReplicationState.SOURCE && to == ReplicationState.DEMOTING) {
            return RequiredOperation.DEMOTE;
        }
        if (to == ReplicationState.SYNCING) {
            return RequiredOperation.RESYNC;
        }
        return RequiredOperation.ENSURE;
    }

    public Set<ReplicationState> allowedTargets(ReplicationState from) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of());
    }

    public List<TransitionRecord> getHistory() {
        return history.snapshot();
    }

    public List<TransitionRecord> getHistory(String intent) {
        return history.snapshot().stream()
            .filter(r -> r.intent().equals(intent))
            .toList();
    }

    private void append(String intent, ReplicationState from, ReplicationState to,
                        String reason, String requestId, boolean accepted) {
        history.append(new TransitionRecord(intent, from, to, reason, requestId, clock.instant(), accepted));
        metricsRegistry.recordStateTransition(from, to, accepted);
        structuredLogger.reconcile().transition(String.valueOf(from), String.valueOf(to), accepted, reason);
    }
}
