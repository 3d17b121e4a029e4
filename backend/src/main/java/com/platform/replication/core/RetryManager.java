package com.platform.replication.core;

import com.platform.replication.error.ReconcileTimeoutException;
import com.platform.replication.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Retries fallible operations with exponential backoff and jitter.
 *
 * Only failures the ErrorClassifier marks RETRYABLE are retried. Per-key attempt counters exist
 * only while a key is retrying and are dropped on success or when the loop gives up.
 * Interrupting the calling thread aborts the backoff sleep immediately.
 */
@Slf4j
@Component
public class RetryManager {

    private final RetryPolicy policy;
    private final ErrorClassifier errorClassifier;
    private final MetricsRegistry metricsRegistry;
    private final Sleeper sleeper;
    private final Map<String, AtomicInteger> retryCounters = new ConcurrentHashMap<>();

    @Autowired
    public RetryManager(
            ErrorClassifier errorClassifier,
            MetricsRegistry metricsRegistry,
            @Value("${replication.retry.max-attempts:5}") int maxAttempts,
            @Value("${replication.retry.initial-delay-ms:1000}") long initialDelayMs,
            @Value("${replication.retry.max-delay-ms:30000}") long maxDelayMs,
            @Value("${replication.retry.multiplier:2.0}") double multiplier,
            @Value("${replication.retry.jitter-factor:0.1}") double jitterFactor) {
        this(new RetryPolicy(maxAttempts, Duration.ofMillis(initialDelayMs), Duration.ofMillis(maxDelayMs),
                multiplier, jitterFactor),
            errorClassifier, metricsRegistry, Sleeper.THREAD);
    }

    public RetryManager(RetryPolicy policy, ErrorClassifier errorClassifier,
                        MetricsRegistry metricsRegistry, Sleeper sleeper) {
        this.policy = policy;
        this.errorClassifier = errorClassifier;
        this.metricsRegistry = metricsRegistry;
        this.sleeper = sleeper;
    }

    /**
     * Execute an operation with retry logic. The last failure is rethrown unchanged once
     * attempts are exhausted or a non-retryable failure occurs.
     */
    public <T> T withRetry(String key, Supplier<T> operation) {
        int attempt = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                retryCounters.remove(key);
                throw ReconcileTimeoutException.interrupted("Retry of " + key,
                    new InterruptedException("interrupted before attempt " + (attempt + 1)));
            }
            try {
                T result = operation.get();

                if (attempt > 0) {
                    log.info("{} succeeded after {} attempts", key, attempt + 1);
                }
                retryCounters.remove(key);
                return result;

            } catch (RuntimeException e) {
                attempt++;

                ErrorClassifier.Disposition disposition = errorClassifier.classify(e);
                if (disposition != ErrorClassifier.Disposition.RETRYABLE) {
                    log.debug("{} failed with {} error, not retrying: {}", key, disposition, e.getMessage());
                    retryCounters.remove(key);
                    throw e;
                }

                metricsRegistry.recordRetryAttempt(operationName(key), attempt);
                log.warn("{} failed (attempt {}/{}): {}", key, attempt, policy.maxAttempts(), e.getMessage());

                if (attempt >= policy.maxAttempts()) {
                    log.error("{} failed after {} attempts", key, attempt);
                    metricsRegistry.recordRetryExhausted(operationName(key));
                    retryCounters.remove(key);
                    throw e;
                }

                retryCounters.computeIfAbsent(key, k -> new AtomicInteger()).set(attempt);
                Duration delay = computeDelay(attempt - 1);
                log.debug("Retrying {} in {}ms", key, delay.toMillis());
                pause(key, delay);
            }
        }
    }

    /**
     * Execute an operation with retry logic (void return).
     */
    public void withRetry(String key, Runnable operation) {
        withRetry(key, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Delay before retry number {@code retryIndex} (0 for the first retry):
     * min(maxDelay, initialDelay * multiplier^retryIndex) plus up to jitterFactor of that.
     */
    public Duration computeDelay(int retryIndex) {
        double exponential = policy.initialDelay().toMillis() * Math.pow(policy.multiplier(), retryIndex);
        long base = (long) Math.min(exponential, policy.maxDelay().toMillis());
        long jitter = (long) (base * policy.jitterFactor() * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(base + jitter);
    }

    /**
     * Get current retry count for a key; 0 when the key is not retrying.
     */
    public int getRetryCount(String key) {
        AtomicInteger counter = retryCounters.get(key);
        return counter != null ? counter.get() : 0;
    }

    public Map<String, Integer> getAllRetryCounts() {
        Map<String, Integer> counts = new ConcurrentHashMap<>();
        retryCounters.forEach((k, v) -> counts.put(k, v.get()));
        return counts;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private void pause(String key, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            retryCounters.remove(key);
            throw ReconcileTimeoutException.interrupted("Retry backoff of " + key, ie);
        }
    }

    // keys look like "<operation>:<namespace>/<name>"
    private static String operationName(String key) {
        int idx = key.indexOf(':');
        return idx > 0 ? key.substring(0, idx) : key;
    }
}
