package com.platform.replication.discovery;

import com.platform.replication.error.DiscoveryException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Detects which storage backends are installed.
 *
 * Results are cached for a TTL. A failing detector never fails the caller: the backend keeps
 * its last successfully detected descriptor (or UNKNOWN) and the error is reported in the result.
 */
@Slf4j
@Component
public class DiscoveryService {

    private final List<BackendDetector> detectors;
    private final Settings settings;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final ExecutorService probeExecutor;

    private final AtomicReference<CachedResult> cache = new AtomicReference<>();
    private final Map<Backend, BackendDescriptor> lastKnown = new ConcurrentHashMap<>();
    private final AtomicInteger probeRounds = new AtomicInteger();
    private final Object refreshLock = new Object();

    @Autowired
    public DiscoveryService(
            List<BackendDetector> detectors,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${replication.discovery.cache-ttl-ms:300000}") long cacheTtlMs,
            @Value("${replication.discovery.timeout-per-backend-ms:10000}") long timeoutPerBackendMs,
            @Value("${replication.discovery.max-retries:3}") int maxRetries,
            @Value("${replication.discovery.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${replication.discovery.enabled-backends:ceph,trident,powerstore}") Collection<String> enabledBackends) {
        this(detectors, new Settings(Duration.ofMillis(cacheTtlMs), Duration.ofMillis(timeoutPerBackendMs),
                maxRetries, Duration.ofMillis(retryDelayMs), Settings.parseBackends(enabledBackends)),
            metricsRegistry, structuredLogger, clock);
    }

    public DiscoveryService(List<BackendDetector> detectors, Settings settings, MetricsRegistry metricsRegistry,
                            StructuredLogger structuredLogger, Clock clock) {
        this.detectors = detectors.stream()
            .sorted(Comparator.comparing(BackendDetector::backend))
            .toList();
        this.settings = settings;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "discovery-probe");
            thread.setDaemon(true);
            return thread;
        });
        metricsRegistry.registerGauge("replication.discovery.available.backends", this::cachedAvailableCount);
    }

    /**
     * Discovery result, re-probing only when the cached one has expired.
     */
    public DiscoveryResult discover() {
        CachedResult cached = cache.get();
        if (cached != null && cached.isFresh(clock.instant())) {
            return cached.result();
        }
        synchronized (refreshLock) {
            cached = cache.get();
            if (cached != null && cached.isFresh(clock.instant())) {
                return cached.result();
            }
            return probeAndCache();
        }
    }

    /**
     * Force a probe regardless of the cache.
     */
    public DiscoveryResult refresh() {
        synchronized (refreshLock) {
            return probeAndCache();
        }
    }

    /**
     * Drop the cached result so the next call probes.
     */
    public void invalidate() {
        cache.set(null);
        log.debug("Discovery cache invalidated");
    }

    /**
     * Number of probe rounds run since startup.
     */
    public int probeRounds() {
        return probeRounds.get();
    }

    public Settings settings() {
        return settings;
    }

    @PreDestroy
    public void shutdown() {
        probeExecutor.shutdownNow();
    }

    private DiscoveryResult probeAndCache() {
        long start = System.currentTimeMillis();
        probeRounds.incrementAndGet();

        List<BackendDescriptor> descriptors = new ArrayList<>();
        Map<Backend, String> probeErrors = new LinkedHashMap<>();

        for (BackendDetector detector : detectors) {
            Backend backend = detector.backend();
            if (!settings.enabledBackends().contains(backend)) {
                descriptors.add(BackendDescriptor.unavailable(backend, "Disabled by configuration", clock.instant()));
                continue;
            }
            try {
                BackendDescriptor descriptor = probe(detector);
                lastKnown.put(backend, descriptor);
                descriptors.add(descriptor);
            } catch (DiscoveryException e) {
                log.warn("Discovery probe for {} failed: {}", backend, e.getMessage());
                structuredLogger.discovery().probeFailed(backend.id(), e.getMessage());
                probeErrors.put(backend, e.getMessage());
                descriptors.add(lastKnown.getOrDefault(backend,
                    BackendDescriptor.unknown(backend, e.getMessage(), clock.instant())));
            }
        }

        Instant now = clock.instant();
        DiscoveryResult result = DiscoveryResult.of(descriptors, now, probeErrors);
        cache.set(new CachedResult(result, now.plus(settings.cacheTtl())));

        Map<String, Object> statuses = new LinkedHashMap<>();
        descriptors.forEach(d -> {
            statuses.put(d.backend().id(), d.status().name());
            metricsRegistry.recordDiscoveryProbe(d.backend().id(), d.status().name());
        });
        structuredLogger.discovery().completed(statuses, System.currentTimeMillis() - start);
        log.info("Discovery completed: available={}, errors={}", result.availableBackends(), probeErrors.keySet());
        return result;
    }

    /**
     * Run one detector with a per-attempt timeout and a fixed delay between attempts.
     */
    private BackendDescriptor probe(BackendDetector detector) {
        Throwable lastError = null;
        for (int attempt = 1; attempt <= settings.maxRetries(); attempt++) {
            Future<BackendDescriptor> future = probeExecutor.submit(detector::detect);
            try {
                return future.get(settings.probeTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = new TimeoutException("probe timed out after " + settings.probeTimeout().toMillis() + "ms");
            } catch (ExecutionException e) {
                lastError = e.getCause();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw DiscoveryException.probeFailed(detector.backend().id(), e);
            }

            log.debug("Probe attempt {}/{} for {} failed: {}", attempt, settings.maxRetries(),
                detector.backend(), lastError.getMessage());
            if (attempt < settings.maxRetries()) {
                try {
                    Thread.sleep(settings.retryDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw DiscoveryException.probeFailed(detector.backend().id(), e);
                }
            }
        }
        throw DiscoveryException.probeFailed(detector.backend().id(), lastError);
    }

    private int cachedAvailableCount() {
        CachedResult cached = cache.get();
        return cached == null ? 0 : cached.result().availableBackends().size();
    }

    private record CachedResult(DiscoveryResult result, Instant expiresAt) {
        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    /**
     * Discovery tuning.
     *
     * @param maxRetries total probe attempts per backend and round
     */
    public record Settings(
        Duration cacheTtl,
        Duration probeTimeout,
        int maxRetries,
        Duration retryDelay,
        Set<Backend> enabledBackends
    ) {
        public Settings {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be at least 1");
            }
            enabledBackends = enabledBackends.isEmpty() ? Set.of() : EnumSet.copyOf(enabledBackends);
        }

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(5), Duration.ofSeconds(10), 3, Duration.ofSeconds(1),
                EnumSet.allOf(Backend.class));
        }

        static Set<Backend> parseBackends(Collection<String> ids) {
            Set<Backend> backends = EnumSet.noneOf(Backend.class);
            for (String id : ids) {
                backends.add(Backend.fromId(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown backend in configuration: " + id)));
            }
            return backends;
        }
    }
}
