package com.platform.replication.reconciliation;

import com.platform.replication.model.Condition;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationStatus;
import com.platform.replication.support.Intents;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperationKindTest {

    private final ReplicationIntent fresh = Intents.intent("orders", Intents.spec("ceph-rbd", null));

    @Test
    void intentWithoutConditionsIsCreated() {
        assertThat(OperationKind.of(fresh)).isEqualTo(OperationKind.CREATE);
    }

    @Test
    void readyAndObservedIntentIsSynced() {
        ReplicationIntent ready = fresh.withStatus(ReplicationStatus.empty()
            .withCondition(Condition.ready(true, "ReconciliationSucceeded", "ok", Intents.T0))
            .withObservedGeneration(1));

        assertThat(OperationKind.of(ready)).isEqualTo(OperationKind.SYNC);
    }

    @Test
    void newGenerationOrNotReadyIsAnUpdate() {
        ReplicationIntent stale = fresh.withStatus(ReplicationStatus.empty()
            .withCondition(Condition.ready(true, "ReconciliationSucceeded", "ok", Intents.T0))
            .withObservedGeneration(0));
        ReplicationIntent failing = fresh.withStatus(ReplicationStatus.empty()
            .withCondition(Condition.ready(false, "AdapterError", "boom", Intents.T0))
            .withObservedGeneration(1));

        assertThat(OperationKind.of(stale)).isEqualTo(OperationKind.UPDATE);
        assertThat(OperationKind.of(failing)).isEqualTo(OperationKind.UPDATE);
    }

    @Test
    void tombstoneWinsOverEverything() {
        ReplicationIntent deleted = fresh.withMetadata(fresh.metadata().markedForDeletion(Intents.T0));

        assertThat(OperationKind.of(deleted)).isEqualTo(OperationKind.DELETE);
        assertThat(OperationKind.DELETE.tag()).isEqualTo("delete");
    }
}
