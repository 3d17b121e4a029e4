package com.platform.replication.reconciliation;

import com.platform.replication.model.IntentKey;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationSpec;
import com.platform.replication.model.ReplicationStatus;

import java.util.List;
import java.util.Optional;

/**
 * Declarative object store holding replication intents.
 *
 * Methods that address an existing intent throw
 * {@link com.platform.replication.error.ResourceNotFoundException} when it is absent.
 */
public interface IntentStore {

    Optional<ReplicationIntent> get(IntentKey key);

    List<ReplicationIntent> list();

    /**
     * @throws com.platform.replication.error.ResourceConflictException if the key is taken
     */
    ReplicationIntent create(IntentKey key, ReplicationSpec spec);

    /**
     * Replace the desired fields. The generation is bumped only when they actually change.
     */
    ReplicationIntent updateSpec(IntentKey key, ReplicationSpec spec);

    ReplicationIntent updateStatus(IntentKey key, ReplicationStatus status);

    ReplicationIntent addFinalizer(IntentKey key, String finalizer);

    /**
     * Remove a finalizer. A tombstoned intent left without finalizers is removed for good.
     *
     * @return the intent, or empty when it was finalized by this call
     */
    Optional<ReplicationIntent> removeFinalizer(IntentKey key, String finalizer);

    /**
     * Tombstone an intent. Without finalizers it is removed immediately.
     *
     * @return the tombstoned intent, or empty when it was removed
     */
    Optional<ReplicationIntent> requestDeletion(IntentKey key);
}
