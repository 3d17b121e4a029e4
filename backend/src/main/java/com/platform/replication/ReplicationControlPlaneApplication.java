package com.platform.replication;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Replication Control Plane Application
 *
 * Reconciles backend-agnostic replication intents onto one of several storage backends:
 * - Ceph (VolumeReplication)
 * - NetApp Trident (TridentMirrorRelationship)
 * - Dell PowerStore (DellCSIReplicationGroup)
 *
 * Features:
 * - Backend discovery and selection
 * - Vocabulary translation per backend
 * - Validated state transitions with audit history
 * - Retries and per-backend circuit breakers
 */
@SpringBootApplication
@EnableScheduling
public class ReplicationControlPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplicationControlPlaneApplication.class, args);
    }
}
