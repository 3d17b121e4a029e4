package com.platform.replication.model;

import com.platform.replication.state.ReplicationState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Observed status of an intent. Written exclusively by the controller.
 *
 * {@code currentState} is what the backend reports and may be lossy (Trident folds its
 * established sub-states together). {@code appliedState} is the last desired state the controller
 * carried out successfully; transitions are validated from it.
 */
public record ReplicationStatus(
    List<Condition> conditions,
    long observedGeneration,
    ReplicationState currentState,
    ReplicationMode currentMode,
    ReplicationState appliedState,
    Backend backend,
    BackendHealth health,
    Instant lastSyncTime,
    List<BackendDescriptor> discoveredBackends
) {
    public ReplicationStatus {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        discoveredBackends = discoveredBackends == null ? List.of() : List.copyOf(discoveredBackends);
        health = health == null ? BackendHealth.UNKNOWN : health;
    }

    public static ReplicationStatus empty() {
        return new ReplicationStatus(List.of(), 0, null, null, null, null, BackendHealth.UNKNOWN, null, List.of());
    }

    public Optional<Condition> condition(String type) {
        return conditions.stream().filter(c -> c.type().equals(type)).findFirst();
    }

    public boolean isReady() {
        return condition(Condition.READY).map(Condition::isTrue).orElse(false);
    }

    /**
     * Merge a condition by type: it replaces the previous condition of the same type and keeps
     * that condition's position. The transition time is only moved when the status flips.
     */
    public ReplicationStatus withCondition(Condition condition) {
        List<Condition> merged = new ArrayList<>(conditions.size() + 1);
        boolean replaced = false;
        for (Condition existing : conditions) {
            if (existing.type().equals(condition.type())) {
                merged.add(existing.status() == condition.status()
                    ? condition.withTransitionTime(existing.lastTransitionTime())
                    : condition);
                replaced = true;
            } else {
                merged.add(existing);
            }
        }
        if (!replaced) {
            merged.add(condition);
        }
        return new ReplicationStatus(merged, observedGeneration, currentState, currentMode,
            appliedState, backend, health, lastSyncTime, discoveredBackends);
    }

    public ReplicationStatus withObserved(ReplicationState state, ReplicationMode mode,
                                          BackendHealth health, Instant lastSyncTime) {
        return new ReplicationStatus(conditions, observedGeneration, state, mode,
            appliedState, backend, health, lastSyncTime, discoveredBackends);
    }

    public ReplicationStatus withAppliedState(ReplicationState applied) {
        return new ReplicationStatus(conditions, observedGeneration, currentState, currentMode,
            applied, backend, health, lastSyncTime, discoveredBackends);
    }

    public ReplicationStatus withObservedGeneration(long generation) {
        return new ReplicationStatus(conditions, generation, currentState, currentMode,
            appliedState, backend, health, lastSyncTime, discoveredBackends);
    }

    public ReplicationStatus withBackend(Backend backend, List<BackendDescriptor> discovered) {
        return new ReplicationStatus(conditions, observedGeneration, currentState, currentMode,
            appliedState, backend, health, lastSyncTime, discovered);
    }
}
