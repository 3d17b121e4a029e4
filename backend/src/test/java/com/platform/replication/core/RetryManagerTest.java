package com.platform.replication.core;

import com.platform.replication.error.AdapterException;
import com.platform.replication.error.CircuitOpenException;
import com.platform.replication.error.ErrorCode;
import com.platform.replication.error.ReconcileTimeoutException;
import com.platform.replication.error.ValidationException;
import com.platform.replication.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryManagerTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy noJitter = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.0);
    private final RetryManager retryManager = new RetryManager(noJitter, new ErrorClassifier(),
        new MetricsRegistry(new SimpleMeterRegistry()), sleeps::add);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void retryableFailureIsAttemptedMaxAttemptsTimes() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryManager.withRetry("create:db/orders", () -> {
            calls.incrementAndGet();
            throw AdapterException.operationFailed("ceph", "create", "db/orders", new IllegalStateException("busy"));
        })).isInstanceOf(AdapterException.class);

        assertThat(calls).hasValue(5);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2),
            Duration.ofSeconds(4), Duration.ofSeconds(8));
        assertThat(retryManager.getRetryCount("create:db/orders")).isZero();
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryManager.withRetry("status:db/orders", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("connection reset");
            }
            return "primary";
        });

        assertThat(result).isEqualTo("primary");
        assertThat(calls).hasValue(3);
        assertThat(retryManager.getAllRetryCounts()).isEmpty();
    }

    @Test
    void terminalFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryManager.withRetry("create:db/orders", () -> {
            calls.incrementAndGet();
            throw ValidationException.missing("volumeMapping");
        })).isInstanceOf(ValidationException.class);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void openCircuitIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryManager.withRetry("update:db/orders", () -> {
            calls.incrementAndGet();
            throw new CircuitOpenException("ceph", null);
        })).isInstanceOf(CircuitOpenException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void interruptedThreadStopsBeforeTheFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> retryManager.withRetry("delete:db/orders", () -> {
            calls.incrementAndGet();
        }))
            .isInstanceOf(ReconcileTimeoutException.class)
            .satisfies(e -> assertThat(((ReconcileTimeoutException) e).getErrorCode())
                .isEqualTo(ErrorCode.RECONCILE_INTERRUPTED));
        assertThat(calls).hasValue(0);
    }

    @Test
    void interruptedBackoffAbortsTheLoop() {
        RetryManager interruptingSleeper = new RetryManager(noJitter, new ErrorClassifier(),
            new MetricsRegistry(new SimpleMeterRegistry()), d -> {
                throw new InterruptedException("cancelled");
            });
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> interruptingSleeper.withRetry("resync:db/orders", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("timeout");
        })).isInstanceOf(ReconcileTimeoutException.class);

        assertThat(calls).hasValue(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void delayIsCappedAndJitterStaysWithinBounds() {
        RetryManager jittered = new RetryManager(RetryPolicy.defaults(), new ErrorClassifier(),
            new MetricsRegistry(new SimpleMeterRegistry()), sleeps::add);

        assertThat(jittered.computeDelay(10)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(33));
        assertThat(jittered.computeDelay(0)).isBetween(Duration.ofMillis(1000), Duration.ofMillis(1100));
    }
}
