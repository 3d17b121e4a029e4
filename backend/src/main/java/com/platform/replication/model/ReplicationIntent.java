package com.platform.replication.model;

/**
 * Backend-agnostic desired-replication record plus its observed status.
 */
public record ReplicationIntent(
    IntentMetadata metadata,
    ReplicationSpec spec,
    ReplicationStatus status
) {
    public ReplicationIntent {
        status = status == null ? ReplicationStatus.empty() : status;
    }

    public IntentKey key() {
        return metadata.key();
    }

    public String name() {
        return metadata.name();
    }

    public String namespace() {
        return metadata.namespace();
    }

    public ReplicationIntent withMetadata(IntentMetadata metadata) {
        return new ReplicationIntent(metadata, spec, status);
    }

    public ReplicationIntent withSpec(ReplicationSpec spec) {
        return new ReplicationIntent(metadata, spec, status);
    }

    public ReplicationIntent withStatus(ReplicationStatus status) {
        return new ReplicationIntent(metadata, spec, status);
    }
}
