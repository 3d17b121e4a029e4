package com.platform.replication.connectors.resource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Native declarative API of the backends.
 * Implementations may block on the network; every method may throw unchecked transport failures.
 */
public interface BackendResourceClient {

    /**
     * Read a record; empty when it does not exist.
     */
    Optional<BackendResource> get(String kind, String namespace, String name);

    /**
     * List records of a kind whose labels contain every entry of the selector.
     */
    List<BackendResource> list(String kind, String namespace, Map<String, String> labelSelector);

    /**
     * Create a record.
     *
     * @throws com.platform.replication.error.ResourceConflictException if it already exists
     */
    BackendResource create(BackendResource resource);

    /**
     * Replace the spec, labels and annotations of an existing record; the status is kept.
     *
     * @throws com.platform.replication.error.ResourceNotFoundException if it does not exist
     */
    BackendResource update(BackendResource resource);

    /**
     * Delete a record.
     *
     * @return false when there was nothing to delete
     */
    boolean delete(String kind, String namespace, String name);

    /**
     * Whether the API currently serves a resource kind.
     */
    boolean servesKind(String kind);
}
