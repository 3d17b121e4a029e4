package com.platform.replication.reconciliation;

import com.platform.replication.model.Condition;
import com.platform.replication.model.ReplicationStatus;
import com.platform.replication.support.Intents;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionMergeTest {

    private final Instant later = Intents.T0.plusSeconds(60);

    @Test
    void conditionsStayUniquePerType() {
        ReplicationStatus status = ReplicationStatus.empty()
            .withCondition(Condition.ready(false, "AdapterError", "first", Intents.T0))
            .withCondition(Condition.synced(true, "StatusUpdated", "synced", Intents.T0))
            .withCondition(Condition.ready(false, "AdapterError", "second", later));

        assertThat(status.conditions()).extracting(Condition::type)
            .containsExactly(Condition.READY, Condition.SYNCED);
        assertThat(status.condition(Condition.READY).orElseThrow().message()).isEqualTo("second");
    }

    @Test
    void transitionTimeMovesOnlyWhenStatusFlips() {
        ReplicationStatus status = ReplicationStatus.empty()
            .withCondition(Condition.ready(false, "AdapterError", "down", Intents.T0))
            .withCondition(Condition.ready(false, "AdapterError", "still down", later));
        assertThat(status.condition(Condition.READY).orElseThrow().lastTransitionTime()).isEqualTo(Intents.T0);

        status = status.withCondition(Condition.ready(true, "ReconciliationSucceeded", "ok", later));
        assertThat(status.condition(Condition.READY).orElseThrow().lastTransitionTime()).isEqualTo(later);
    }
}
