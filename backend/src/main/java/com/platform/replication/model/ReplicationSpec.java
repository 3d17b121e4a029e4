package com.platform.replication.model;

import com.platform.replication.state.ReplicationState;

import java.util.Map;

/**
 * Desired fields of an intent. Owned by the caller; the controller never writes them.
 */
public record ReplicationSpec(
    ReplicationState desiredState,
    ReplicationMode desiredMode,
    VolumeMapping volumeMapping,
    Endpoint sourceEndpoint,
    Endpoint destinationEndpoint,
    Schedule schedule,
    String backendHint,
    Map<String, String> parameters
) {
    public ReplicationSpec {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        schedule = schedule == null ? Schedule.continuous() : schedule;
    }

    /**
     * Backend-specific knob, or the fallback when it is absent or blank.
     */
    public String parameter(String name, String fallback) {
        String value = parameters.get(name);
        return value == null || value.isBlank() ? fallback : value;
    }

    public ReplicationSpec withDesiredState(ReplicationState state) {
        return new ReplicationSpec(state, desiredMode, volumeMapping, sourceEndpoint,
            destinationEndpoint, schedule, backendHint, parameters);
    }
}
