package com.platform.replication.reconciliation;

import com.platform.replication.connectors.AdapterRegistry;
import com.platform.replication.model.Backend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controller liveness derived from reconcile activity.
 */
@Component
public class ControllerHealth {

    private static final double MAX_ERROR_RATE = 0.5;

    private final AdapterRegistry adapterRegistry;
    private final Clock clock;
    private final Duration staleAfter;

    private final AtomicLong reconcileCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicReference<Instant> lastReconcile = new AtomicReference<>();
    private volatile boolean ready;

    public ControllerHealth(
            AdapterRegistry adapterRegistry,
            Clock clock,
            @Value("${replication.controller.stale-after-ms:600000}") long staleAfterMs) {
        this.adapterRegistry = adapterRegistry;
        this.clock = clock;
        this.staleAfter = Duration.ofMillis(staleAfterMs);
    }

    public void recordReconcile(boolean success) {
        reconcileCount.incrementAndGet();
        if (!success) {
            errorCount.incrementAndGet();
        }
        lastReconcile.set(clock.instant());
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public boolean isReady() {
        return ready;
    }

    public Report check() {
        Instant now = clock.instant();
        boolean healthy = true;
        String message = null;
        Map<String, Object> details = new LinkedHashMap<>();

        Instant last = lastReconcile.get();
        if (last != null) {
            Duration since = Duration.between(last, now);
            details.put("time_since_reconcile", since.toString());
            if (since.compareTo(staleAfter) > 0) {
                healthy = false;
                message = "No reconciliation in " + since;
            }
        }

        long count = reconcileCount.get();
        double errorRate = count == 0 ? 0.0 : (double) errorCount.get() / count;
        details.put("error_rate", String.format("%.2f%%", errorRate * 100));
        if (errorRate > MAX_ERROR_RATE) {
            healthy = false;
            message = String.format("High error rate: %.2f%%", errorRate * 100);
        }

        Map<Backend, Boolean> adapters = adapterRegistry.health();
        details.put("adapters", adapters);
        if (adapters.isEmpty()) {
            healthy = false;
            message = "No replication adapters registered";
        }

        if (healthy) {
            message = "All systems operational";
        }
        return new Report(healthy, now, last, count, errorRate, message, details);
    }

    public record Report(
        boolean healthy,
        Instant lastCheck,
        Instant lastReconcile,
        long reconcileCount,
        double errorRate,
        String message,
        Map<String, Object> details
    ) {
    }
}
