package com.platform.replication.connectors.resource;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic backend-native declarative record. Nested spec and status values are
 * plain maps, lists, strings, numbers and booleans.
 */
public record BackendResource(
    String apiVersion,
    String kind,
    String namespace,
    String name,
    Map<String, String> labels,
    Map<String, String> annotations,
    Map<String, Object> spec,
    Map<String, Object> status,
    long resourceVersion
) {
    public BackendResource {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        spec = spec == null ? Map.of() : Map.copyOf(spec);
        status = status == null ? Map.of() : Map.copyOf(status);
    }

    public static BackendResource of(String apiVersion, String kind, String namespace, String name,
                                     Map<String, String> labels, Map<String, Object> spec) {
        return new BackendResource(apiVersion, kind, namespace, name, labels, Map.of(), spec, Map.of(), 0);
    }

    public String key() {
        return kind + ":" + namespace + "/" + name;
    }

    public BackendResource withSpec(Map<String, Object> spec) {
        return new BackendResource(apiVersion, kind, namespace, name, labels, annotations, spec, status, resourceVersion);
    }

    public BackendResource withSpecField(String field, Object value) {
        Map<String, Object> updated = new HashMap<>(spec);
        updated.put(field, value);
        return withSpec(updated);
    }

    public BackendResource withAnnotation(String key, String value) {
        Map<String, String> updated = new HashMap<>(annotations);
        updated.put(key, value);
        return new BackendResource(apiVersion, kind, namespace, name, labels, updated, spec, status, resourceVersion);
    }

    public BackendResource withStatus(Map<String, Object> status) {
        return new BackendResource(apiVersion, kind, namespace, name, labels, annotations, spec, status, resourceVersion);
    }

    public BackendResource withResourceVersion(long resourceVersion) {
        return new BackendResource(apiVersion, kind, namespace, name, labels, annotations, spec, status, resourceVersion);
    }

    public String specString(String field) {
        Object value = spec.get(field);
        return value == null ? null : value.toString();
    }

    public String statusString(String field) {
        Object value = status.get(field);
        return value == null ? null : value.toString();
    }
}
