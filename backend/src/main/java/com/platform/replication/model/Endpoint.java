package com.platform.replication.model;

import java.util.Objects;

/**
 * Cluster-side descriptor of one end of a replication pair.
 * The storage class doubles as a backend selection hint.
 */
public record Endpoint(String cluster, String region, String storageClass) {

    public boolean sameLocationAs(Endpoint other) {
        return other != null
            && Objects.equals(cluster, other.cluster)
            && Objects.equals(region, other.region);
    }
}
