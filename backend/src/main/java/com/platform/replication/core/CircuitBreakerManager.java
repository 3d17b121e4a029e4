package com.platform.replication.core;

import com.platform.replication.error.CircuitOpenException;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Circuit breakers guarding backend calls, one per backend.
 *
 * Closed opens after failureThreshold consecutive failures, Open moves to Half-Open on the first
 * call after recoveryTimeout, Half-Open closes after successThreshold successes and reopens on any
 * failure. Terminal failures are ignored by the breaker: they say nothing about backend health.
 */
@Slf4j
@Component
public class CircuitBreakerManager {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final ErrorClassifier errorClassifier;

    public CircuitBreakerManager(
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            ErrorClassifier errorClassifier) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.errorClassifier = errorClassifier;

        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerEventListeners);
        circuitBreakerRegistry.getEventPublisher()
            .onEntryAdded(event -> registerEventListeners(event.getAddedEntry()));
    }

    /**
     * Breaker configuration reproducing consecutive-failure semantics on a count-based window:
     * a window of failureThreshold calls that must all fail.
     */
    public static CircuitBreakerConfig breakerConfig(int failureThreshold, int successThreshold,
                                                     Duration recoveryTimeout, ErrorClassifier classifier) {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(recoveryTimeout)
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .permittedNumberOfCallsInHalfOpenState(successThreshold)
            .ignoreException(classifier::isTerminal)
            .build();
    }

    /**
     * Run an operation through the named breaker.
     *
     * @throws CircuitOpenException when the breaker does not permit the call; the operation is not invoked
     */
    public <T> T call(String name, Supplier<T> operation) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(name);

        if (!cb.tryAcquirePermission()) {
            metricsRegistry.recordCircuitBreakerRejection(name);
            throw new CircuitOpenException(name, CallNotPermittedException.createCallNotPermittedException(cb));
        }

        long start = System.nanoTime();
        try {
            T result = operation.get();
            cb.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            return result;
        } catch (RuntimeException e) {
            if (!errorClassifier.isTerminal(e) && reopenIfHalfOpen(cb)) {
                throw e;
            }
            cb.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            throw e;
        }
    }

    // one failed probe reopens the breaker without waiting for the remaining probes
    private boolean reopenIfHalfOpen(CircuitBreaker cb) {
        synchronized (cb) {
            if (cb.getState() == CircuitBreaker.State.HALF_OPEN) {
                cb.transitionToOpenState();
                return true;
            }
            return false;
        }
    }

    public void run(String name, Runnable operation) {
        call(name, () -> {
            operation.run();
            return null;
        });
    }

    private void registerEventListeners(CircuitBreaker circuitBreaker) {
        String name = circuitBreaker.getName();
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String fromState = event.getStateTransition().getFromState().name();
                String toState = event.getStateTransition().getToState().name();

                log.info("Circuit breaker {} state change: {} -> {}", name, fromState, toState);
                metricsRegistry.recordCircuitBreakerStateChange(name, toState);
                structuredLogger.resilience().breakerStateChanged(name, fromState, toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}",
                name, event.getThrowable().getMessage()))
            .onCallNotPermitted(event -> log.debug("Circuit breaker {} rejected a call", name));
    }

    /**
     * Get circuit breaker state.
     */
    public CircuitBreaker.State getState(String name) {
        return circuitBreakerRegistry.circuitBreaker(name).getState();
    }

    /**
     * Get all circuit breaker states, by name.
     */
    public Map<String, CircuitBreakerStatus> getAllStates() {
        Map<String, CircuitBreakerStatus> states = new TreeMap<>();
        for (CircuitBreaker cb : circuitBreakerRegistry.getAllCircuitBreakers()) {
            states.put(cb.getName(), CircuitBreakerStatus.of(cb));
        }
        return states;
    }

    public CircuitBreakerStatus getStatus(String name) {
        return circuitBreakerRegistry.find(name)
            .map(CircuitBreakerStatus::of)
            .orElse(null);
    }

    /**
     * Force circuit breaker to closed state.
     */
    public void forceClose(String name) {
        circuitBreakerRegistry.circuitBreaker(name).transitionToClosedState();
        log.info("Forced circuit breaker {} to closed state", name);
    }

    /**
     * Force circuit breaker to open state. It still moves to half-open after the recovery timeout.
     */
    public void forceOpen(String name) {
        circuitBreakerRegistry.circuitBreaker(name).transitionToOpenState();
        log.info("Forced circuit breaker {} to open state", name);
    }

    /**
     * Reset circuit breaker (clear metrics and transition to closed).
     */
    public void reset(String name) {
        circuitBreakerRegistry.circuitBreaker(name).reset();
        log.info("Reset circuit breaker {}", name);
    }

    /**
     * Circuit breaker status record.
     */
    public record CircuitBreakerStatus(
        String state,
        int successfulCalls,
        int failedCalls,
        float failureRate,
        long notPermittedCalls
    ) {
        static CircuitBreakerStatus of(CircuitBreaker cb) {
            CircuitBreaker.Metrics metrics = cb.getMetrics();
            return new CircuitBreakerStatus(
                cb.getState().name(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getFailureRate(),
                metrics.getNumberOfNotPermittedCalls());
        }
    }
}
