package com.platform.replication.connectors.powerstore;

import com.platform.replication.connectors.AdapterStatus;
import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.BackendResource;
import com.platform.replication.connectors.resource.InMemoryBackendResourceClient;
import com.platform.replication.error.AdapterException;
import com.platform.replication.model.BackendHealth;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationMode;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.support.Intents;
import com.platform.replication.translation.TranslationEngine;
import com.platform.replication.translation.TranslationTables;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PowerStoreAdapterTest {

    private final InMemoryBackendResourceClient client = new InMemoryBackendResourceClient(List.of());
    private final PowerStoreAdapter adapter = new PowerStoreAdapter(client, new TranslationEngine(TranslationTables.all()),
        new MetricsRegistry(new SimpleMeterRegistry()), Clock.fixed(Intents.T0.plusMillis(750), ZoneOffset.UTC));

    private final ReplicationIntent intent = Intents.intent("orders",
        Intents.spec(ReplicationState.SOURCE, "powerstore-ext4", null,
            Map.of(PowerStoreAdapter.PARAM_PROTECTION_POLICY, "gold-15m")));

    @Test
    void ensureWritesReplicationGroup() {
        adapter.ensureReplication(intent);

        BackendResource group = client.get(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders").orElseThrow();
        assertThat(group.spec())
            .containsEntry("driverName", PowerStoreAdapter.DRIVER_NAME)
            .containsEntry("state", "source")
            .containsEntry("replicationPolicy", "ASYNC")
            .containsEntry("protectionPolicy", "gold-15m")
            .containsEntry("remoteSystem", "west-1")
            .containsEntry("remoteRPO", "15m")
            .containsEntry("pvcSelector", Map.of("matchLabels", Map.of(PowerStoreAdapter.GROUP_LABEL, "orders")));
    }

    @Test
    void demoteRewritesTheGroupState() {
        adapter.ensureReplication(intent);

        adapter.demote(intent);

        assertThat(client.get(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders").orElseThrow().specString("state"))
            .isEqualTo("destination");
    }

    @Test
    void resyncAnnotatesTheGroup() {
        adapter.ensureReplication(intent);

        adapter.resync(intent);

        assertThat(client.get(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders").orElseThrow().annotations())
            .containsEntry(PowerStoreAdapter.RESYNC_ANNOTATION, "2024-05-01T10:00:00Z");
    }

    @Test
    void statusWithFailedConditionIsUnhealthy() {
        adapter.ensureReplication(intent);
        client.reportStatus(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders", Map.of(
            "state", "failed",
            "conditions", List.of(Map.of("type", "Failed", "status", "True", "message", "link down"))));

        AdapterStatus status = adapter.getStatus(intent);

        assertThat(status.state()).isEqualTo(ReplicationState.FAILED);
        assertThat(status.mode()).isEqualTo(ReplicationMode.ASYNCHRONOUS);
        assertThat(status.health()).isEqualTo(BackendHealth.UNHEALTHY);
    }

    @Test
    void unknownBackendStateLeavesStateEmpty() {
        adapter.ensureReplication(intent);
        client.reportStatus(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders", Map.of("state", "halted"));

        AdapterStatus status = adapter.getStatus(intent);

        assertThat(status.state()).isNull();
        assertThat(status.health()).isEqualTo(BackendHealth.UNKNOWN);
        assertThat(status.message()).contains("halted");
    }

    @Test
    void blankProtectionPolicyIsRejected() {
        ReplicationIntent blank = Intents.intent("orders", Intents.spec(ReplicationState.SOURCE, "powerstore-ext4",
            null, Map.of(PowerStoreAdapter.PARAM_PROTECTION_POLICY, " ")));

        assertThatThrownBy(() -> adapter.validateConfiguration(blank)).isInstanceOf(AdapterException.class);
    }
}
