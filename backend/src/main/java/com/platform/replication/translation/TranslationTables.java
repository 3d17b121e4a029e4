package com.platform.replication.translation;

import com.platform.replication.model.Backend;

import java.util.List;
import java.util.Map;

/**
 * Vocabulary of each supported backend.
 * The unified "eventual" mode has no native counterpart anywhere and is left unmapped.
 */
public final class TranslationTables {

    private TranslationTables() {
    }

    public static TranslationMap ceph() {
        return TranslationMap.of(Backend.CEPH,
            Map.of(
                "source", "primary",
                "replica", "secondary",
                "syncing", "resync",
                "promoting", "resync-promote",
                "demoting", "resync-demote",
                "failed", "error"),
            Map.of(
                "synchronous", "sync",
                "asynchronous", "async"));
    }

    public static TranslationMap trident() {
        return TranslationMap.of(Backend.TRIDENT,
            Map.of(
                "source", "established",
                "replica", "established-replica",
                "syncing", "established-syncing",
                "promoting", "promoted",
                "demoting", "reestablished",
                "failed", "established-failed"),
            Map.of(
                "synchronous", "Sync",
                "asynchronous", "Async"));
    }

    public static TranslationMap powerStore() {
        return TranslationMap.of(Backend.POWERSTORE,
            Map.of(
                "source", "source",
                "replica", "destination",
                "syncing", "syncing",
                "promoting", "promoting",
                "demoting", "demoting",
                "failed", "failed"),
            Map.of(
                "synchronous", "SYNC",
                "asynchronous", "ASYNC"));
    }

    public static List<TranslationMap> all() {
        return List.of(ceph(), trident(), powerStore());
    }
}
