package com.platform.replication.connectors.resource;

import com.platform.replication.error.ResourceConflictException;
import com.platform.replication.error.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local backend API used when no cluster is attached.
 * Status is written by {@link #reportStatus}, which stands in for the backend's own controller.
 */
@Slf4j
@Component
public class InMemoryBackendResourceClient implements BackendResourceClient {

    private final Map<String, BackendResource> resources = new ConcurrentHashMap<>();
    private final Set<String> servedKinds = ConcurrentHashMap.newKeySet();
    private final AtomicLong versions = new AtomicLong();

    public InMemoryBackendResourceClient(
            @Value("${replication.backend-api.served-kinds:"
                + "VolumeReplication,VolumeReplicationClass,TridentMirrorRelationship,"
                + "TridentActionMirrorUpdate,DellCSIReplicationGroup}") Collection<String> servedKinds) {
        this.servedKinds.addAll(servedKinds);
        log.info("In-memory backend API serving kinds {}", this.servedKinds);
    }

    @Override
    public Optional<BackendResource> get(String kind, String namespace, String name) {
        return Optional.ofNullable(resources.get(key(kind, namespace, name)));
    }

    @Override
    public List<BackendResource> list(String kind, String namespace, Map<String, String> labelSelector) {
        return resources.values().stream()
            .filter(r -> r.kind().equals(kind))
            .filter(r -> namespace == null || Objects.equals(r.namespace(), namespace))
            .filter(r -> r.labels().entrySet().containsAll(labelSelector.entrySet()))
            .sorted(Comparator.comparing(BackendResource::name))
            .toList();
    }

    @Override
    public BackendResource create(BackendResource resource) {
        BackendResource stored = resource.withResourceVersion(versions.incrementAndGet());
        BackendResource previous = resources.putIfAbsent(resource.key(), stored);
        if (previous != null) {
            throw new ResourceConflictException(resource.kind(), resource.namespace() + "/" + resource.name());
        }
        log.debug("Created {}", resource.key());
        return stored;
    }

    @Override
    public BackendResource update(BackendResource resource) {
        BackendResource updated = resources.computeIfPresent(resource.key(), (k, existing) ->
            new BackendResource(resource.apiVersion(), resource.kind(), resource.namespace(), resource.name(),
                resource.labels(), resource.annotations(), resource.spec(), existing.status(),
                versions.incrementAndGet()));
        if (updated == null) {
            throw ResourceNotFoundException.backendRecord(resource.kind(), resource.namespace() + "/" + resource.name());
        }
        log.debug("Updated {}", resource.key());
        return updated;
    }

    @Override
    public boolean delete(String kind, String namespace, String name) {
        return resources.remove(key(kind, namespace, name)) != null;
    }

    @Override
    public boolean servesKind(String kind) {
        return servedKinds.contains(kind);
    }

    /**
     * Write the status block of a record, as the backend would after acting on it.
     */
    public void reportStatus(String kind, String namespace, String name, Map<String, Object> status) {
        BackendResource updated = resources.computeIfPresent(key(kind, namespace, name), (k, existing) ->
            existing.withStatus(status).withResourceVersion(versions.incrementAndGet()));
        if (updated == null) {
            throw ResourceNotFoundException.backendRecord(kind, namespace + "/" + name);
        }
    }

    public void serveKind(String kind) {
        servedKinds.add(kind);
    }

    public void stopServingKind(String kind) {
        servedKinds.remove(kind);
    }

    public int size() {
        return resources.size();
    }

    private static String key(String kind, String namespace, String name) {
        return kind + ":" + namespace + "/" + name;
    }
}
