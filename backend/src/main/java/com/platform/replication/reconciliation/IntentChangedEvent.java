package com.platform.replication.reconciliation;

import com.platform.replication.model.IntentKey;

/**
 * Published by the intent store when an intent needs reconciling.
 * Status writes do not produce events.
 */
public record IntentChangedEvent(IntentKey key, Type type) {

    public enum Type {
        CREATED,
        SPEC_UPDATED,
        DELETION_REQUESTED
    }
}
