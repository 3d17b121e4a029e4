package com.platform.replication.reconciliation;

import com.platform.replication.model.ReplicationIntent;

import java.util.Locale;

/**
 * What a single reconcile does with an intent.
 */
public enum OperationKind {
    /** No conditions recorded yet. */
    CREATE,
    /** Desired fields changed since the last observation, or the intent is not ready. */
    UPDATE,
    /** Nothing changed; observed status is refreshed without mutating the backend. */
    SYNC,
    /** Deletion requested. */
    DELETE;

    public static OperationKind of(ReplicationIntent intent) {
        if (intent.metadata().isDeletionRequested()) {
            return DELETE;
        }
        if (intent.status().conditions().isEmpty()) {
            return CREATE;
        }
        if (intent.metadata().generation() != intent.status().observedGeneration() || !intent.status().isReady()) {
            return UPDATE;
        }
        return SYNC;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
