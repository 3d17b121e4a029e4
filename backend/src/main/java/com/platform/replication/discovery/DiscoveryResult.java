package com.platform.replication.discovery;

import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of one discovery round. Backends are listed in discovery order.
 *
 * @param probeErrors error text per backend whose probe failed in this round
 */
public record DiscoveryResult(
    List<BackendDescriptor> backends,
    List<Backend> availableBackends,
    Instant discoveredAt,
    Map<Backend, String> probeErrors
) {
    public DiscoveryResult {
        backends = List.copyOf(backends);
        availableBackends = List.copyOf(availableBackends);
        probeErrors = Map.copyOf(probeErrors);
    }

    public static DiscoveryResult of(List<BackendDescriptor> backends, Instant discoveredAt,
                                     Map<Backend, String> probeErrors) {
        List<Backend> available = backends.stream()
            .filter(BackendDescriptor::isAvailable)
            .map(BackendDescriptor::backend)
            .toList();
        return new DiscoveryResult(backends, available, discoveredAt, probeErrors);
    }

    public Optional<BackendDescriptor> descriptor(Backend backend) {
        return backends.stream().filter(d -> d.backend() == backend).findFirst();
    }

    public boolean isAvailable(Backend backend) {
        return availableBackends.contains(backend);
    }
}
