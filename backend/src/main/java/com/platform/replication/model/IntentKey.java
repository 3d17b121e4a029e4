package com.platform.replication.model;

import java.util.Objects;

/**
 * Unique identity of an intent: namespace-like scope plus name.
 */
public record IntentKey(String namespace, String name) {

    public IntentKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static IntentKey of(String namespace, String name) {
        return new IntentKey(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
