package com.platform.replication.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Store-owned bookkeeping of an intent.
 *
 * @param generation        bumped by the store on every change to the desired fields
 * @param deletionTimestamp tombstone; non-null once deletion has been requested
 * @param finalizers        cleanup markers that keep a tombstoned intent alive
 */
public record IntentMetadata(
    String namespace,
    String name,
    long generation,
    Instant createdAt,
    Instant deletionTimestamp,
    Set<String> finalizers
) {
    public IntentMetadata {
        finalizers = finalizers == null ? Set.of() : Set.copyOf(finalizers);
    }

    public static IntentMetadata create(String namespace, String name, Instant now) {
        return new IntentMetadata(namespace, name, 1, now, null, Set.of());
    }

    public IntentKey key() {
        return new IntentKey(namespace, name);
    }

    public boolean isDeletionRequested() {
        return deletionTimestamp != null;
    }

    public boolean hasFinalizer(String finalizer) {
        return finalizers.contains(finalizer);
    }

    public IntentMetadata withFinalizer(String finalizer) {
        Set<String> updated = new LinkedHashSet<>(finalizers);
        updated.add(finalizer);
        return new IntentMetadata(namespace, name, generation, createdAt, deletionTimestamp, updated);
    }

    public IntentMetadata withoutFinalizer(String finalizer) {
        Set<String> updated = new LinkedHashSet<>(finalizers);
        updated.remove(finalizer);
        return new IntentMetadata(namespace, name, generation, createdAt, deletionTimestamp, updated);
    }

    public IntentMetadata nextGeneration() {
        return new IntentMetadata(namespace, name, generation + 1, createdAt, deletionTimestamp, finalizers);
    }

    public IntentMetadata markedForDeletion(Instant now) {
        return new IntentMetadata(namespace, name, generation, createdAt, now, finalizers);
    }
}
