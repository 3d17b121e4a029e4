package com.platform.replication.discovery;

import com.platform.replication.error.DiscoveryException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.BackendDescriptor;
import com.platform.replication.model.Endpoint;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the backend that will serve an intent.
 *
 * Priority:
 * 1. explicit backend hint, which must name an available backend
 * 2. storage class keywords, checked in a fixed order against available backends
 * 3. first available backend (unless strict selection is on)
 */
@Slf4j
@Component
public class BackendSelector {

    public static final String RULE_HINT = "hint";
    public static final String RULE_STORAGE_CLASS = "storage-class";
    public static final String RULE_FALLBACK = "fallback";

    private static final Map<Backend, List<String>> STORAGE_CLASS_KEYWORDS;

    static {
        Map<Backend, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(Backend.CEPH, List.of("ceph", "rbd"));
        keywords.put(Backend.TRIDENT, List.of("trident", "netapp", "ontap"));
        keywords.put(Backend.POWERSTORE, List.of("powerstore", "dell"));
        STORAGE_CLASS_KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final StructuredLogger structuredLogger;
    private final boolean strictSelection;

    public BackendSelector(
            StructuredLogger structuredLogger,
            @Value("${replication.controller.strict-selection:false}") boolean strictSelection) {
        this.structuredLogger = structuredLogger;
        this.strictSelection = strictSelection;
    }

    public Selection select(ReplicationIntent intent, DiscoveryResult discovery) {
        String hint = intent.spec().backendHint();
        if (hint != null && !hint.isBlank()) {
            Backend backend = Backend.fromId(hint)
                .orElseThrow(() -> DiscoveryException.hintNotSatisfiable(hint, "unknown backend"));
            if (!discovery.isAvailable(backend)) {
                String status = discovery.descriptor(backend)
                    .map(BackendDescriptor::status)
                    .map(Enum::name)
                    .orElse("NOT_DISCOVERED");
                throw DiscoveryException.hintNotSatisfiable(hint, "backend is not available (" + status + ")");
            }
            return selected(backend, RULE_HINT);
        }

        String storageClass = storageClassOf(intent.spec().sourceEndpoint());
        if (storageClass != null) {
            for (Map.Entry<Backend, List<String>> entry : STORAGE_CLASS_KEYWORDS.entrySet()) {
                boolean matches = entry.getValue().stream().anyMatch(storageClass::contains);
                if (matches && discovery.isAvailable(entry.getKey())) {
                    return selected(entry.getKey(), RULE_STORAGE_CLASS);
                }
            }
        }

        if (!strictSelection && !discovery.availableBackends().isEmpty()) {
            Backend fallback = discovery.availableBackends().get(0);
            log.warn("No hint or storage class match for {}; falling back to first available backend {}",
                intent.key(), fallback);
            return selected(fallback, RULE_FALLBACK);
        }

        throw DiscoveryException.noBackendAvailable(intent.key().toString());
    }

    public boolean isStrictSelection() {
        return strictSelection;
    }

    private Selection selected(Backend backend, String rule) {
        structuredLogger.reconcile().backendSelected(backend.id(), rule);
        return new Selection(backend, rule);
    }

    private static String storageClassOf(Endpoint endpoint) {
        if (endpoint == null || endpoint.storageClass() == null || endpoint.storageClass().isBlank()) {
            return null;
        }
        return endpoint.storageClass().toLowerCase(Locale.ROOT);
    }

    /**
     * Chosen backend and the rule that chose it.
     */
    public record Selection(Backend backend, String rule) {
    }
}
