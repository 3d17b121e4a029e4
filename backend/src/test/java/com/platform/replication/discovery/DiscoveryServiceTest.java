package com.platform.replication.discovery;

import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import com.platform.replication.support.Intents;
import com.platform.replication.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DiscoveryServiceTest {

    private final MutableClock clock = new MutableClock(Intents.T0);
    private DiscoveryService service;

    @AfterEach
    void shutdown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void cachedResultIsReusedUntilTheTtlExpires() {
        ScriptedDetector ceph = new ScriptedDetector(Backend.CEPH);
        service = service(settings(EnumSet.allOf(Backend.class)), ceph);

        service.discover();
        service.discover();
        assertThat(ceph.calls).hasValue(1);

        clock.advance(Duration.ofMinutes(5));
        service.discover();
        service.discover();

        assertThat(ceph.calls).hasValue(2);
        assertThat(service.probeRounds()).isEqualTo(2);
    }

    @Test
    void refreshAndInvalidateBypassTheCache() {
        ScriptedDetector ceph = new ScriptedDetector(Backend.CEPH);
        service = service(settings(EnumSet.allOf(Backend.class)), ceph);

        service.discover();
        service.refresh();
        service.invalidate();
        service.discover();

        assertThat(ceph.calls).hasValue(3);
    }

    @Test
    void failingProbeKeepsTheLastKnownDescriptor() {
        ScriptedDetector trident = new ScriptedDetector(Backend.TRIDENT);
        service = service(settings(EnumSet.allOf(Backend.class)), trident);

        assertThat(service.discover().isAvailable(Backend.TRIDENT)).isTrue();

        trident.failing = true;
        DiscoveryResult result = service.refresh();

        assertThat(result.isAvailable(Backend.TRIDENT)).isTrue();
        assertThat(result.probeErrors()).containsKey(Backend.TRIDENT);
        assertThat(trident.calls).hasValue(1 + 2);
    }

    @Test
    void neverDetectedBackendIsUnknownWhenItsProbeFails() {
        ScriptedDetector ceph = new ScriptedDetector(Backend.CEPH);
        ceph.failing = true;
        ScriptedDetector powerStore = new ScriptedDetector(Backend.POWERSTORE);
        service = service(settings(EnumSet.allOf(Backend.class)), powerStore, ceph);

        DiscoveryResult result = service.discover();

        assertThat(result.descriptor(Backend.CEPH)).get()
            .extracting(BackendDescriptor::status).isEqualTo(BackendDescriptor.Status.UNKNOWN);
        assertThat(result.availableBackends()).containsExactly(Backend.POWERSTORE);
        assertThat(result.backends()).extracting(BackendDescriptor::backend)
            .containsExactly(Backend.CEPH, Backend.POWERSTORE);
    }

    @Test
    void slowProbeTimesOut() {
        ScriptedDetector ceph = new ScriptedDetector(Backend.CEPH);
        ceph.delay = Duration.ofSeconds(5);
        service = service(new DiscoveryService.Settings(Duration.ofMinutes(5), Duration.ofMillis(50), 1,
            Duration.ZERO, EnumSet.allOf(Backend.class)), ceph);

        DiscoveryResult result = service.discover();

        assertThat(result.isAvailable(Backend.CEPH)).isFalse();
        assertThat(result.probeErrors().get(Backend.CEPH)).contains("timed out");
    }

    @Test
    void disabledBackendIsNotProbed() {
        ScriptedDetector ceph = new ScriptedDetector(Backend.CEPH);
        ScriptedDetector trident = new ScriptedDetector(Backend.TRIDENT);
        service = service(settings(EnumSet.of(Backend.TRIDENT)), ceph, trident);

        DiscoveryResult result = service.discover();

        assertThat(ceph.calls).hasValue(0);
        assertThat(result.descriptor(Backend.CEPH)).get()
            .extracting(BackendDescriptor::status).isEqualTo(BackendDescriptor.Status.UNAVAILABLE);
        assertThat(result.availableBackends()).containsExactly(Backend.TRIDENT);
    }

    private DiscoveryService service(DiscoveryService.Settings settings, BackendDetector... detectors) {
        return new DiscoveryService(List.of(detectors), settings,
            new MetricsRegistry(new SimpleMeterRegistry()), new StructuredLogger("test"), clock);
    }

    private static DiscoveryService.Settings settings(Set<Backend> enabled) {
        return new DiscoveryService.Settings(Duration.ofMinutes(5), Duration.ofSeconds(2), 2, Duration.ZERO, enabled);
    }

    private class ScriptedDetector implements BackendDetector {

        private final Backend backend;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile boolean failing;
        private volatile Duration delay = Duration.ZERO;

        ScriptedDetector(Backend backend) {
            this.backend = backend;
        }

        @Override
        public Backend backend() {
            return backend;
        }

        @Override
        public BackendDescriptor detect() {
            calls.incrementAndGet();
            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("probe cancelled", e);
                }
            }
            if (failing) {
                throw new IllegalStateException("api server unreachable");
            }
            return BackendDescriptor.available(backend, Set.of("resync"), clock.instant());
        }
    }
}
