package com.platform.replication.state;

import com.platform.replication.error.InvalidTransitionException;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplicationStateMachineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private ReplicationStateMachine stateMachine(int historySize) {
        return new ReplicationStateMachine(new MetricsRegistry(new SimpleMeterRegistry()),
            new StructuredLogger("test"), clock, historySize);
    }

    @Test
    void stayingInTheSameStateIsAlwaysAllowed() {
        ReplicationStateMachine machine = stateMachine(10);
        for (ReplicationState state : ReplicationState.values()) {
            assertThat(machine.isTransitionAllowed(state, state)).isTrue();
            assertThat(machine.validateTransition(state, state)).isEqualTo(RequiredOperation.ENSURE);
        }
    }

    @Test
    void graphEdgesMapToAdapterOperations() {
        ReplicationStateMachine machine = stateMachine(10);

        assertThat(machine.validateTransition(ReplicationState.REPLICA, ReplicationState.PROMOTING))
            .isEqualTo(RequiredOperation.PROMOTE);
        assertThat(machine.validateTransition(ReplicationState.SOURCE, ReplicationState.DEMOTING))
            .isEqualTo(RequiredOperation.DEMOTE);
        assertThat(machine.validateTransition(ReplicationState.FAILED, ReplicationState.SYNCING))
            .isEqualTo(RequiredOperation.RESYNC);
        assertThat(machine.validateTransition(ReplicationState.PROMOTING, ReplicationState.SOURCE))
            .isEqualTo(RequiredOperation.ENSURE);
    }

    @Test
    void sourceAndReplicaCannotSwapDirectly() {
        ReplicationStateMachine machine = stateMachine(10);

        assertThat(machine.isTransitionAllowed(ReplicationState.SOURCE, ReplicationState.REPLICA)).isFalse();
        assertThat(machine.isTransitionAllowed(ReplicationState.PROMOTING, ReplicationState.REPLICA)).isFalse();
        assertThatThrownBy(() -> machine.validateTransition(ReplicationState.SOURCE, ReplicationState.REPLICA))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(machine.isTransitionAllowed(ReplicationState.REPLICA, ReplicationState.SOURCE)).isFalse();
        assertThatThrownBy(() -> machine.validateTransition(ReplicationState.REPLICA, ReplicationState.SOURCE))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void rejectedRequestIsRecordedBeforeThrowing() {
        ReplicationStateMachine machine = stateMachine(10);

        assertThatThrownBy(() -> machine.requestTransition("db/orders", ReplicationState.DEMOTING,
                ReplicationState.SOURCE, "r-1"))
            .isInstanceOf(InvalidTransitionException.class);

        assertThat(machine.getHistory("db/orders"))
            .singleElement()
            .satisfies(record -> {
                assertThat(record.accepted()).isFalse();
                assertThat(record.reason()).isEqualTo(ReplicationStateMachine.REASON_REJECTED);
                assertThat(record.requestId()).isEqualTo("r-1");
                assertThat(record.timestamp()).isEqualTo(clock.instant());
            });
    }

    @Test
    void acceptedRequestIsNotRecordedUntilCarriedOut() {
        ReplicationStateMachine machine = stateMachine(10);

        machine.requestTransition("db/orders", ReplicationState.REPLICA, ReplicationState.PROMOTING, "r-1");
        assertThat(machine.getHistory()).isEmpty();

        machine.recordTransition("db/orders", ReplicationState.REPLICA, ReplicationState.PROMOTING, "promote", "r-1");
        assertThat(machine.getHistory()).singleElement()
            .satisfies(record -> assertThat(record.accepted()).isTrue());
    }

    @Test
    void historyKeepsOnlyTheNewestRecords() {
        ReplicationStateMachine machine = stateMachine(3);

        for (int i = 0; i < 5; i++) {
            machine.recordTransition("ns/intent-" + i, ReplicationState.REPLICA, ReplicationState.PROMOTING, "promote", "r-" + i);
        }

        assertThat(machine.getHistory())
            .extracting(TransitionRecord::intent)
            .containsExactly("ns/intent-2", "ns/intent-3", "ns/intent-4");
    }

    @Test
    void historyFiltersByIntent() {
        ReplicationStateMachine machine = stateMachine(10);
        machine.recordTransition("a/one", ReplicationState.REPLICA, ReplicationState.PROMOTING, "promote", "r-1");
        machine.recordTransition("a/two", ReplicationState.SOURCE, ReplicationState.DEMOTING, "demote", "r-2");

        assertThat(machine.getHistory("a/two")).extracting(TransitionRecord::to).containsExactly(ReplicationState.DEMOTING);
    }
}
