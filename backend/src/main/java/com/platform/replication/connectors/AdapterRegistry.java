package com.platform.replication.connectors;

import com.platform.replication.error.TranslationException;
import com.platform.replication.model.Backend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adapters keyed by backend. The only place that maps a backend to its implementation.
 */
@Slf4j
@Component
public class AdapterRegistry {

    private final Map<Backend, ReplicationAdapter> adapters;

    public AdapterRegistry(List<ReplicationAdapter> adapters) {
        Map<Backend, ReplicationAdapter> byBackend = new EnumMap<>(Backend.class);
        for (ReplicationAdapter adapter : adapters) {
            ReplicationAdapter previous = byBackend.put(adapter.backend(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for backend " + adapter.backend());
            }
        }
        this.adapters = Collections.unmodifiableMap(byBackend);
        log.info("Registered replication adapters for {}", this.adapters.keySet());
    }

    /**
     * Adapter for a backend.
     *
     * @throws TranslationException if no adapter is registered for it
     */
    public ReplicationAdapter get(Backend backend) {
        ReplicationAdapter adapter = adapters.get(backend);
        if (adapter == null) {
            throw TranslationException.unsupportedBackend(backend.id());
        }
        return adapter;
    }

    public Optional<ReplicationAdapter> find(Backend backend) {
        return Optional.ofNullable(adapters.get(backend));
    }

    public Set<Backend> registeredBackends() {
        return adapters.keySet();
    }

    /**
     * Local liveness of every adapter.
     */
    public Map<Backend, Boolean> health() {
        Map<Backend, Boolean> health = new EnumMap<>(Backend.class);
        adapters.forEach((backend, adapter) -> health.put(backend, adapter.isHealthy()));
        return health;
    }
}
