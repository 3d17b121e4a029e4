package com.platform.replication.model;

import java.time.Instant;
import java.util.Set;

/**
 * Discovery verdict for one backend.
 */
public record BackendDescriptor(
    Backend backend,
    Status status,
    Set<String> capabilities,
    String message,
    Instant detectedAt
) {
    public enum Status {
        /** Every required resource kind is served. */
        AVAILABLE,
        /** Some required kinds are missing. */
        PARTIAL,
        UNAVAILABLE,
        /** Never probed successfully. */
        UNKNOWN
    }

    public BackendDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static BackendDescriptor available(Backend backend, Set<String> capabilities, Instant now) {
        return new BackendDescriptor(backend, Status.AVAILABLE, capabilities,
            "All required resource kinds are served", now);
    }

    public static BackendDescriptor partial(Backend backend, String message, Instant now) {
        return new BackendDescriptor(backend, Status.PARTIAL, Set.of(), message, now);
    }

    public static BackendDescriptor unavailable(Backend backend, String message, Instant now) {
        return new BackendDescriptor(backend, Status.UNAVAILABLE, Set.of(), message, now);
    }

    public static BackendDescriptor unknown(Backend backend, String message, Instant now) {
        return new BackendDescriptor(backend, Status.UNKNOWN, Set.of(), message, now);
    }

    public boolean isAvailable() {
        return status == Status.AVAILABLE;
    }
}
