package com.platform.replication.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Central registry for replication control plane metrics.
 * Wraps the Micrometer registry so components record domain events instead of meter names.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + "." + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Record one reconcile, tagged by operation kind and outcome.
     */
    public void recordReconcile(String operationKind, String outcome, long durationMs) {
        incrementCounter("replication.reconcile.total", "kind", operationKind, "outcome", outcome);
        timer("replication.reconcile.duration", "kind", operationKind).record(Duration.ofMillis(durationMs));
    }

    public void recordReconcileTimeout() {
        incrementCounter("replication.reconcile.timeout");
    }

    /**
     * Record latency and outcome of a single adapter call.
     */
    public void recordAdapterOperation(String backend, String operation, boolean success, long latencyMs) {
        incrementCounter("replication.adapter.operations",
            "backend", backend, "operation", operation, "success", String.valueOf(success));
        timer("replication.adapter.latency", "backend", backend, "operation", operation)
            .record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record retry attempt.
     */
    public void recordRetryAttempt(String operation, int attemptNumber) {
        incrementCounter("replication.retry.attempt", "operation", operation);
        log.debug("Recorded retry attempt {} for {}", attemptNumber, operation);
    }

    public void recordRetryExhausted(String operation) {
        incrementCounter("replication.retry.exhausted", "operation", operation);
    }

    /**
     * Record circuit breaker state change.
     */
    public void recordCircuitBreakerStateChange(String breaker, String state) {
        incrementCounter("replication.circuitbreaker.state", "breaker", breaker, "state", state);

        int stateValue = switch (state.toLowerCase()) {
            case "open", "forced_open" -> 0;
            case "half_open" -> 1;
            case "closed" -> 2;
            default -> -1;
        };

        gauge("replication.circuitbreaker.current", breaker).set(stateValue);
    }

    public void recordCircuitBreakerRejection(String breaker) {
        incrementCounter("replication.circuitbreaker.rejected", "breaker", breaker);
    }

    /**
     * Record a validated state transition, accepted or rejected.
     */
    public void recordStateTransition(Object fromState, Object toState, boolean accepted) {
        String from = fromState != null ? fromState.toString() : "none";
        String to = toState != null ? toState.toString() : "unknown";

        incrementCounter("replication.state.transition",
            "from", from,
            "to", to,
            "accepted", String.valueOf(accepted));
    }

    public void recordDiscoveryProbe(String backend, String status) {
        incrementCounter("replication.discovery.probe", "backend", backend, "status", status);
    }

    /**
     * Expose a live value (queue depth, tracked intents) as a gauge.
     */
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier).register(meterRegistry);
    }

    private Timer timer(String name, String... tags) {
        String key = name + "." + String.join(".", tags);
        return timers.computeIfAbsent(key, k ->
            Timer.builder(name)
                .tags(tags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
    }

    private AtomicInteger gauge(String name, String breaker) {
        return gaugeValues.computeIfAbsent(name + "." + breaker, k -> {
            AtomicInteger value = new AtomicInteger(-1);
            Gauge.builder(name, value, AtomicInteger::get)
                .tag("breaker", breaker)
                .register(meterRegistry);
            return value;
        });
    }
}
