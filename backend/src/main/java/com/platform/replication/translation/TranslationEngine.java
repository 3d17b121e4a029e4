package com.platform.replication.translation;

import com.platform.replication.error.TranslationException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.state.ReplicationState;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bidirectional lookup between the unified vocabulary and each backend's vocabulary.
 *
 * Tables are fixed at construction; lookups never block and need no locking.
 */
@Slf4j
public class TranslationEngine {

    private final Map<Backend, TranslationMap> maps;

    public TranslationEngine(List<TranslationMap> translationMaps) {
        Map<Backend, TranslationMap> byBackend = new EnumMap<>(Backend.class);
        for (TranslationMap map : translationMaps) {
            if (byBackend.putIfAbsent(map.backend(), map) != null) {
                throw new IllegalArgumentException("Duplicate translation map for backend " + map.backend());
            }
        }
        this.maps = Collections.unmodifiableMap(byBackend);
    }

    public String toBackend(Backend backend, Axis axis, String unifiedToken) {
        String translated = table(backend).forward(axis).get(unifiedToken);
        if (translated == null) {
            throw TranslationException.invalidValue(String.valueOf(backend), axis.toString(), unifiedToken);
        }
        return translated;
    }

    public String fromBackend(Backend backend, Axis axis, String backendToken) {
        String translated = table(backend).reverse(axis).get(backendToken);
        if (translated == null) {
            throw TranslationException.invalidValue(String.valueOf(backend), axis.toString(), backendToken);
        }
        return translated;
    }

    public String stateToBackend(Backend backend, ReplicationState state) {
        return toBackend(backend, Axis.STATE, state.value());
    }

    public ReplicationState stateFromBackend(Backend backend, String backendState) {
        String unified = fromBackend(backend, Axis.STATE, backendState);
        return ReplicationState.fromValue(unified)
            .orElseThrow(() -> TranslationException.inconsistentMapping(backend.id(), Axis.STATE.toString(),
                "reverse table yields unknown unified state '" + unified + "'"));
    }

    public String modeToBackend(Backend backend, ReplicationMode mode) {
        return toBackend(backend, Axis.MODE, mode.value());
    }

    public ReplicationMode modeFromBackend(Backend backend, String backendMode) {
        String unified = fromBackend(backend, Axis.MODE, backendMode);
        return ReplicationMode.fromValue(unified)
            .orElseThrow(() -> TranslationException.inconsistentMapping(backend.id(), Axis.MODE.toString(),
                "reverse table yields unknown unified mode '" + unified + "'"));
    }

    public boolean supports(Backend backend) {
        return backend != null && maps.containsKey(backend);
    }

    public Set<Backend> supportedBackends() {
        return maps.keySet();
    }

    /**
     * Unified tokens of one axis that have a translation for the backend.
     */
    public Set<String> unifiedDomain(Backend backend, Axis axis) {
        return table(backend).forward(axis).keySet();
    }

    /**
     * Checks the round-trip, injectivity and reverse-totality invariants of a backend's tables.
     */
    public void validate(Backend backend) {
        TranslationMap map = table(backend);
        for (Axis axis : Axis.values()) {
            validateAxis(backend, axis, map.forward(axis), map.reverse(axis));
        }
    }

    public void validateAll() {
        maps.keySet().forEach(this::validate);
        log.info("Translation tables validated for backends {}", maps.keySet());
    }

    private void validateAxis(Backend backend, Axis axis, Map<String, String> forward, Map<String, String> reverse) {
        Map<String, String> seen = new HashMap<>();
        for (Map.Entry<String, String> entry : forward.entrySet()) {
            String previous = seen.put(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw TranslationException.inconsistentMapping(backend.id(), axis.toString(),
                    String.format("backend token '%s' shared by '%s' and '%s'", entry.getValue(), previous, entry.getKey()));
            }
            String back = reverse.get(entry.getValue());
            if (!entry.getKey().equals(back)) {
                throw TranslationException.inconsistentMapping(backend.id(), axis.toString(),
                    String.format("'%s' -> '%s' reverses to '%s'", entry.getKey(), entry.getValue(), back));
            }
        }
        for (Map.Entry<String, String> entry : reverse.entrySet()) {
            String there = forward.get(entry.getValue());
            if (!entry.getKey().equals(there)) {
                throw TranslationException.inconsistentMapping(backend.id(), axis.toString(),
                    String.format("reverse '%s' -> '%s' translates back to '%s'", entry.getKey(), entry.getValue(), there));
            }
        }
    }

    private TranslationMap table(Backend backend) {
        TranslationMap map = backend == null ? null : maps.get(backend);
        if (map == null) {
            throw TranslationException.unsupportedBackend(String.valueOf(backend));
        }
        return map;
    }
}
