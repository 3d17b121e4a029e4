package com.platform.replication.config;

import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.BackendResourceClient;
import com.platform.replication.discovery.BackendDetector;
import com.platform.replication.discovery.ResourceKindDetector;
import com.platform.replication.model.Backend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * One detector per supported backend.
 */
@Configuration
public class DiscoveryConfig {

    @Bean
    public BackendDetector cephDetector(BackendResourceClient client, Clock clock) {
        return new ResourceKindDetector(Backend.CEPH,
            List.of(BackendKinds.VOLUME_REPLICATION, BackendKinds.VOLUME_REPLICATION_CLASS),
            Set.of("async_replication", "source_promotion", "replica_demotion",
                "resync", "auto_resync", "journal_based"),
            client, clock);
    }

    @Bean
    public BackendDetector tridentDetector(BackendResourceClient client, Clock clock) {
        return new ResourceKindDetector(Backend.TRIDENT,
            List.of(BackendKinds.TRIDENT_MIRROR_RELATIONSHIP, BackendKinds.TRIDENT_ACTION_MIRROR_UPDATE),
            Set.of("sync_replication", "async_replication", "source_promotion", "replica_demotion",
                "resync", "volume_groups", "scheduled_sync"),
            client, clock);
    }

    @Bean
    public BackendDetector powerStoreDetector(BackendResourceClient client, Clock clock) {
        return new ResourceKindDetector(Backend.POWERSTORE,
            List.of(BackendKinds.DELL_REPLICATION_GROUP),
            Set.of("sync_replication", "async_replication", "metro_replication", "source_promotion",
                "replica_demotion", "resync", "consistency_groups"),
            client, clock);
    }
}
