package com.platform.replication.translation;

import com.platform.replication.model.Backend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable forward (unified to backend) and reverse (backend to unified) tables of one backend.
 */
public final class TranslationMap {

    private final Backend backend;
    private final Map<Axis, Map<String, String>> forward;
    private final Map<Axis, Map<String, String>> reverse;

    public TranslationMap(Backend backend,
                          Map<String, String> stateForward, Map<String, String> stateReverse,
                          Map<String, String> modeForward, Map<String, String> modeReverse) {
        this.backend = Objects.requireNonNull(backend, "backend");
        Map<Axis, Map<String, String>> fwd = new EnumMap<>(Axis.class);
        fwd.put(Axis.STATE, Map.copyOf(stateForward));
        fwd.put(Axis.MODE, Map.copyOf(modeForward));
        Map<Axis, Map<String, String>> rev = new EnumMap<>(Axis.class);
        rev.put(Axis.STATE, Map.copyOf(stateReverse));
        rev.put(Axis.MODE, Map.copyOf(modeReverse));
        this.forward = Collections.unmodifiableMap(fwd);
        this.reverse = Collections.unmodifiableMap(rev);
    }

    /**
     * Builds a map whose reverse tables are the inversion of the forward tables.
     * When two unified tokens share a backend token the first one wins, which validate() reports.
     */
    public static TranslationMap of(Backend backend, Map<String, String> stateForward, Map<String, String> modeForward) {
        return new TranslationMap(backend, stateForward, invert(stateForward), modeForward, invert(modeForward));
    }

    private static Map<String, String> invert(Map<String, String> table) {
        Map<String, String> inverted = new LinkedHashMap<>();
        table.forEach((unified, backendToken) -> inverted.putIfAbsent(backendToken, unified));
        return inverted;
    }

    public Backend backend() {
        return backend;
    }

    public Map<String, String> forward(Axis axis) {
        return forward.get(axis);
    }

    public Map<String, String> reverse(Axis axis) {
        return reverse.get(axis);
    }
}
