package com.platform.replication.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Storage backends the control plane can drive.
 * Declaration order is the documented tie-break order for backend selection.
 */
public enum Backend {
    CEPH("ceph"),
    TRIDENT("trident"),
    POWERSTORE("powerstore");

    private final String id;

    Backend(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<Backend> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(b -> b.id.equals(normalized))
            .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
