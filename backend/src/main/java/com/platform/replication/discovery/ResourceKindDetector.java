package com.platform.replication.discovery;

import com.platform.replication.connectors.resource.BackendResourceClient;
import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Detects a backend by the resource kinds its operator installs.
 * All kinds served means available, some means partial, none means unavailable.
 */
public class ResourceKindDetector implements BackendDetector {

    private final Backend backend;
    private final List<String> requiredKinds;
    private final Set<String> capabilities;
    private final BackendResourceClient client;
    private final Clock clock;

    public ResourceKindDetector(Backend backend, List<String> requiredKinds, Set<String> capabilities,
                                BackendResourceClient client, Clock clock) {
        if (requiredKinds.isEmpty()) {
            throw new IllegalArgumentException("Detector for " + backend + " needs at least one resource kind");
        }
        this.backend = backend;
        this.requiredKinds = List.copyOf(requiredKinds);
        this.capabilities = Set.copyOf(capabilities);
        this.client = client;
        this.clock = clock;
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public BackendDescriptor detect() {
        List<String> missing = requiredKinds.stream()
            .filter(kind -> !client.servesKind(kind))
            .toList();

        if (missing.isEmpty()) {
            return BackendDescriptor.available(backend, capabilities, clock.instant());
        }
        if (missing.size() == requiredKinds.size()) {
            return BackendDescriptor.unavailable(backend,
                "None of the required resource kinds are served: " + missing, clock.instant());
        }
        return BackendDescriptor.partial(backend,
            "Missing resource kinds: " + missing, clock.instant());
    }

    public List<String> requiredKinds() {
        return requiredKinds;
    }
}
