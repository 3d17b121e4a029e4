package com.platform.replication.connectors;

import com.platform.replication.model.Backend;
import com.platform.replication.model.ReplicationIntent;

/**
 * Uniform contract every storage backend implements.
 * Implementations translate the unified vocabulary and own their backend's record shape.
 */
public interface ReplicationAdapter {

    /**
     * Backend this adapter drives.
     */
    Backend backend();

    /**
     * Create or update the backend-native record so it matches the intent. Idempotent.
     */
    void ensureReplication(ReplicationIntent intent);

    /**
     * Remove the backend-native record. Idempotent; an absent record is success.
     */
    void deleteReplication(ReplicationIntent intent);

    /**
     * Observed state, translated back to the unified vocabulary.
     *
     * @throws com.platform.replication.error.AdapterException of type RESOURCE when no record exists
     */
    AdapterStatus getStatus(ReplicationIntent intent);

    void promote(ReplicationIntent intent);

    void demote(ReplicationIntent intent);

    void resync(ReplicationIntent intent);

    /**
     * Backend-specific configuration checks.
     *
     * @throws com.platform.replication.error.AdapterException of type VALIDATION
     */
    void validateConfiguration(ReplicationIntent intent);

    /**
     * Whether this adapter can serve the intent at all.
     */
    boolean supportsConfiguration(ReplicationIntent intent);

    /**
     * Cheap local liveness. Never calls the backend.
     */
    boolean isHealthy();
}
