package com.platform.replication.connectors.resource;

/**
 * Native resource kinds of the supported backends.
 */
public final class BackendKinds {

    public static final String CEPH_API_VERSION = "replication.storage.openshift.io/v1alpha1";
    public static final String VOLUME_REPLICATION = "VolumeReplication";
    public static final String VOLUME_REPLICATION_CLASS = "VolumeReplicationClass";

    public static final String TRIDENT_API_VERSION = "trident.netapp.io/v1";
    public static final String TRIDENT_MIRROR_RELATIONSHIP = "TridentMirrorRelationship";
    public static final String TRIDENT_ACTION_MIRROR_UPDATE = "TridentActionMirrorUpdate";

    public static final String DELL_API_VERSION = "replication.dell.com/v1";
    public static final String DELL_REPLICATION_GROUP = "DellCSIReplicationGroup";

    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "unified-replication-operator";
    public static final String LABEL_INTENT_NAME = "unified-replication.io/name";
    public static final String LABEL_BACKEND = "unified-replication.io/backend";

    private BackendKinds() {
    }
}
