package com.platform.replication.connectors;

import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.BackendResource;
import com.platform.replication.connectors.resource.BackendResourceClient;
import com.platform.replication.error.AdapterException;
import com.platform.replication.error.ControlPlaneException;
import com.platform.replication.error.ResourceConflictException;
import com.platform.replication.error.ResourceNotFoundException;
import com.platform.replication.error.TranslationException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendHealth;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.translation.TranslationEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Shared plumbing for adapters: error wrapping, metrics, liveness and status reading.
 * Subclasses only describe their backend's record shape.
 */
@Slf4j
public abstract class AbstractReplicationAdapter implements ReplicationAdapter {

    static final int UNHEALTHY_AFTER_CONSECUTIVE_FAILURES = 5;

    protected final BackendResourceClient client;
    protected final TranslationEngine translation;
    protected final MetricsRegistry metricsRegistry;
    protected final Clock clock;

    private final Backend backend;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    protected AbstractReplicationAdapter(Backend backend, BackendResourceClient client,
                                         TranslationEngine translation, MetricsRegistry metricsRegistry,
                                         Clock clock) {
        this.backend = backend;
        this.client = client;
        this.translation = translation;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public boolean isHealthy() {
        return consecutiveFailures.get() < UNHEALTHY_AFTER_CONSECUTIVE_FAILURES;
    }

    @Override
    public boolean supportsConfiguration(ReplicationIntent intent) {
        try {
            validateConfiguration(intent);
            return true;
        } catch (ControlPlaneException e) {
            log.debug("{} adapter does not support {}: {}", backend, intent.key(), e.getMessage());
            return false;
        }
    }

    @Override
    public AdapterStatus getStatus(ReplicationIntent intent) {
        return execute("getStatus", intent, () -> {
            BackendResource record = findRecord(intent)
                .orElseThrow(() -> new AdapterException(AdapterException.Type.RESOURCE, backend.id(),
                    "getStatus", intent.key().toString(), "backend record does not exist"));
            return readStatus(record, intent);
        });
    }

    /**
     * Kind and name of the record that carries this intent on the backend.
     */
    protected abstract Optional<BackendResource> findRecord(ReplicationIntent intent);

    /**
     * Run one adapter operation with metrics and error normalization. Control plane exceptions
     * pass through; anything else is treated as a transport fault.
     */
    protected <T> T execute(String operation, ReplicationIntent intent, Supplier<T> action) {
        long start = System.currentTimeMillis();
        try {
            T result = action.get();
            consecutiveFailures.set(0);
            metricsRegistry.recordAdapterOperation(backend.id(), operation, true, System.currentTimeMillis() - start);
            return result;
        } catch (RuntimeException e) {
            RuntimeException normalized = normalize(operation, intent, e);
            if (!(normalized instanceof TranslationException)
                    && !(normalized instanceof AdapterException ae && ae.getType() == AdapterException.Type.VALIDATION)) {
                consecutiveFailures.incrementAndGet();
            }
            metricsRegistry.recordAdapterOperation(backend.id(), operation, false, System.currentTimeMillis() - start);
            throw normalized;
        }
    }

    protected void execute(String operation, ReplicationIntent intent, Runnable action) {
        execute(operation, intent, () -> {
            action.run();
            return null;
        });
    }

    private RuntimeException normalize(String operation, ReplicationIntent intent, RuntimeException e) {
        String resource = intent.key().toString();
        if (e instanceof ResourceNotFoundException) {
            return new AdapterException(AdapterException.Type.RESOURCE, backend.id(), operation, resource,
                e.getMessage(), e);
        }
        if (e instanceof ResourceConflictException) {
            return new AdapterException(AdapterException.Type.OPERATION, backend.id(), operation, resource,
                e.getMessage(), e);
        }
        if (e instanceof ControlPlaneException) {
            return e;
        }
        return new AdapterException(AdapterException.Type.CONNECTION, backend.id(), operation, resource,
            String.valueOf(e.getMessage()), e);
    }

    /**
     * Create the record or replace its spec when it already exists.
     */
    protected BackendResource createOrUpdate(BackendResource desired) {
        Optional<BackendResource> existing = client.get(desired.kind(), desired.namespace(), desired.name());
        if (existing.isEmpty()) {
            log.info("Creating {} for backend {}", desired.key(), backend);
            return client.create(desired);
        }
        BackendResource merged = new BackendResource(desired.apiVersion(), desired.kind(), desired.namespace(),
            desired.name(), desired.labels(), mergeAnnotations(existing.get(), desired), desired.spec(),
            existing.get().status(), existing.get().resourceVersion());
        if (merged.spec().equals(existing.get().spec()) && merged.labels().equals(existing.get().labels())
                && merged.annotations().equals(existing.get().annotations())) {
            log.debug("{} already up to date", desired.key());
            return existing.get();
        }
        log.info("Updating {} for backend {}", desired.key(), backend);
        return client.update(merged);
    }

    private static Map<String, String> mergeAnnotations(BackendResource existing, BackendResource desired) {
        Map<String, String> merged = new HashMap<>(existing.annotations());
        merged.putAll(desired.annotations());
        return merged;
    }

    protected Map<String, String> managedLabels(ReplicationIntent intent) {
        return Map.of(
            BackendKinds.LABEL_MANAGED_BY, BackendKinds.MANAGED_BY_VALUE,
            BackendKinds.LABEL_INTENT_NAME, intent.name(),
            BackendKinds.LABEL_BACKEND, backend.id());
    }

    protected String backendState(ReplicationState state) {
        return translation.stateToBackend(backend, state);
    }

    protected String backendMode(ReplicationMode mode) {
        return translation.modeToBackend(backend, mode);
    }

    protected AdapterException validationFailure(ReplicationIntent intent, String message) {
        return new AdapterException(AdapterException.Type.VALIDATION, backend.id(), "validateConfiguration",
            intent.key().toString(), message);
    }

    /**
     * Mode as observed on the record. Defaults to the translated {@code spec.replicationPolicy}.
     */
    protected ReplicationMode observedMode(BackendResource record, ReplicationIntent intent) {
        String policy = record.specString("replicationPolicy");
        return policy == null ? null : translation.modeFromBackend(backend, policy);
    }

    private AdapterStatus readStatus(BackendResource record, ReplicationIntent intent) {
        List<String> messages = new ArrayList<>();

        String stateToken = Optional.ofNullable(record.statusString("state")).orElse(record.specString("state"));
        if (stateToken == null) {
            stateToken = record.specString("replicationState");
        }
        ReplicationState state = null;
        if (stateToken != null) {
            try {
                state = translation.stateFromBackend(backend, stateToken);
            } catch (TranslationException e) {
                messages.add("Unrecognized backend state '" + stateToken + "'");
            }
        }

        ReplicationMode mode = null;
        try {
            mode = observedMode(record, intent);
        } catch (TranslationException e) {
            messages.add(e.getMessage());
        }

        Health health = assessHealth(record.status().get("conditions"));
        messages.add(health.message());

        return new AdapterStatus(state, mode, health.health(), parseTime(record.statusString("lastSyncTime")),
            String.join("; ", messages));
    }

    private static Health assessHealth(Object rawConditions) {
        if (!(rawConditions instanceof List<?> conditions) || conditions.isEmpty()) {
            return new Health(BackendHealth.UNKNOWN, "No conditions available");
        }
        BackendHealth health = BackendHealth.HEALTHY;
        List<String> messages = new ArrayList<>();
        for (Object raw : conditions) {
            if (!(raw instanceof Map<?, ?> condition)) {
                continue;
            }
            String type = String.valueOf(condition.get("type"));
            boolean isTrue = "True".equals(String.valueOf(condition.get("status")));
            String message = condition.get("message") == null ? "" : String.valueOf(condition.get("message"));
            switch (type) {
                case "Error", "Failed" -> {
                    if (isTrue) {
                        health = BackendHealth.UNHEALTHY;
                        messages.add("Error: " + message);
                    }
                }
                case "Ready" -> {
                    if (!isTrue) {
                        health = health == BackendHealth.HEALTHY ? BackendHealth.DEGRADED : health;
                        messages.add("Not ready: " + message);
                    }
                }
                case "Degraded" -> {
                    if (isTrue) {
                        health = health == BackendHealth.HEALTHY ? BackendHealth.DEGRADED : health;
                        messages.add("Degraded: " + message);
                    }
                }
                default -> {
                }
            }
        }
        if (messages.isEmpty()) {
            messages.add("Backend reports healthy");
        }
        return new Health(health, String.join("; ", messages));
    }

    private static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable lastSyncTime '{}'", value);
            return null;
        }
    }

    private record Health(BackendHealth health, String message) {
    }
}
