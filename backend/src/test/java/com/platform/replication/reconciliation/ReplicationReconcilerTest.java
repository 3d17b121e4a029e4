package com.platform.replication.reconciliation;

import com.platform.replication.connectors.resource.BackendKinds;
import com.platform.replication.connectors.resource.InMemoryBackendResourceClient;
import com.platform.replication.model.Backend;
import com.platform.replication.model.Condition;
import com.platform.replication.model.ConditionStatus;
import com.platform.replication.model.IntentKey;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.state.TransitionRecord;
import com.platform.replication.support.Intents;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ReplicationReconcilerTest {

    private static final IntentKey KEY = IntentKey.of("db", "orders");

    @Test
    void createProvisionsTheBackendRecordAndMarksReady() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        assertThat(result.requeueAfter()).isEqualTo(ReconcilerFixture.SUCCESS_REQUEUE);
        assertThat(fx.backendApi.get(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr")).isPresent();

        ReplicationIntent intent = fx.store.get(KEY).orElseThrow();
        assertThat(intent.metadata().finalizers()).containsExactly(ReplicationReconciler.FINALIZER);
        assertThat(intent.status().isReady()).isTrue();
        assertThat(intent.status().backend()).isEqualTo(Backend.CEPH);
        assertThat(intent.status().observedGeneration()).isEqualTo(1);
        assertThat(intent.status().currentState()).isEqualTo(ReplicationState.SOURCE);
        assertThat(intent.status().condition(Condition.SYNCED)).get()
            .extracting(Condition::status).isEqualTo(ConditionStatus.TRUE);
        assertThat(intent.status().discoveredBackends()).hasSize(3);
    }

    @Test
    void unchangedIntentIsSyncedWithoutTouchingTheBackend() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        fx.reconciler.reconcile(KEY);
        counting.mutations.clear();

        assertThat(OperationKind.of(fx.store.get(KEY).orElseThrow())).isEqualTo(OperationKind.SYNC);
        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        assertThat(counting.mutations).isEmpty();
    }

    @Test
    void syncPicksUpStateReportedByTheBackend() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        fx.reconciler.reconcile(KEY);

        fx.backendApi.reportStatus(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr", Map.of(
            "state", "error",
            "conditions", List.of(Map.of("type", "Failed", "status", "True", "message", "mirror broken"))));
        fx.reconciler.reconcile(KEY);

        ReplicationIntent intent = fx.store.get(KEY).orElseThrow();
        assertThat(intent.status().currentState()).isEqualTo(ReplicationState.FAILED);
        assertThat(intent.status().condition(Condition.SYNCED).orElseThrow().message()).contains("failed");
    }

    @Test
    void demoteIsCarriedOutAndRecorded() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        fx.reconciler.reconcile(KEY);

        fx.store.updateSpec(KEY, Intents.spec(ReplicationState.DEMOTING, "ceph-rbd", null, Map.of()));
        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        assertThat(fx.backendApi.get(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr").orElseThrow()
            .specString("replicationState")).isEqualTo("resync-demote");
        assertThat(fx.stateMachine.getHistory(KEY.toString()))
            .filteredOn(TransitionRecord::accepted)
            .extracting(TransitionRecord::from, TransitionRecord::to, TransitionRecord::reason)
            .contains(tuple(ReplicationState.SOURCE, ReplicationState.DEMOTING, "demote"));
        assertThat(fx.store.get(KEY).orElseThrow().status().observedGeneration()).isEqualTo(2);
    }

    @Test
    void invalidTransitionIsRejectedRecordedAndNotRequeued() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        fx.reconciler.reconcile(KEY);

        fx.store.updateSpec(KEY, Intents.spec(ReplicationState.REPLICA, "ceph-rbd", null, Map.of()));
        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TERMINAL);
        assertThat(result.shouldRequeue()).isFalse();
        assertThat(fx.stateMachine.getHistory(KEY.toString()))
            .filteredOn(r -> !r.accepted())
            .singleElement()
            .satisfies(r -> assertThat(r.to()).isEqualTo(ReplicationState.REPLICA));

        Condition ready = fx.store.get(KEY).orElseThrow().status().condition(Condition.READY).orElseThrow();
        assertThat(ready.isTrue()).isFalse();
        assertThat(ready.reason()).isEqualTo(ReplicationReconciler.REASON_INVALID_TRANSITION);
        assertThat(fx.backendApi.get(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr").orElseThrow()
            .specString("replicationState")).isEqualTo("primary");
    }

    @Test
    void adapterValidationFailureIsTerminal() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec("standard", "ceph"));

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TERMINAL);
        assertThat(fx.backendApi.size()).isZero();
        assertThat(fx.store.get(KEY).orElseThrow().status().condition(Condition.READY).orElseThrow().reason())
            .isEqualTo(ReplicationReconciler.REASON_VALIDATION_FAILED);
    }

    @Test
    void noInstalledBackendFailsSelection() {
        ReconcilerFixture fx = new ReconcilerFixture(new InMemoryBackendResourceClient(List.of()));
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.TERMINAL);
        assertThat(fx.store.get(KEY).orElseThrow().status().condition(Condition.READY).orElseThrow().reason())
            .isEqualTo(ReplicationReconciler.REASON_BACKEND_SELECTION_FAILED);
    }

    @Test
    void transientBackendFailureIsRetriedThenRequeued() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        counting.failWrites = new IllegalStateException("connection refused");
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.FAILED);
        assertThat(result.requeueAfter()).isEqualTo(ReconcilerFixture.FAILURE_REQUEUE);
        assertThat(counting.mutations).hasSize(3);
        ReplicationIntent intent = fx.store.get(KEY).orElseThrow();
        assertThat(intent.status().condition(Condition.READY).orElseThrow().reason())
            .isEqualTo(ReplicationReconciler.REASON_ADAPTER_ERROR);
        assertThat(intent.metadata().finalizers()).containsExactly(ReplicationReconciler.FINALIZER);
        assertThat(intent.status().appliedState()).isNull();
    }

    @Test
    void tridentReplicaRunsAFullFailoverAndFailbackCycle() {
        ReconcilerFixture fx = new ReconcilerFixture();
        fx.store.create(KEY, Intents.spec(ReplicationState.REPLICA, "netapp-gold", null, Map.of()));
        assertThat(fx.reconciler.reconcile(KEY).outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        // Trident reports established-replica as plain "established"
        assertThat(fx.store.get(KEY).orElseThrow().status().currentState()).isEqualTo(ReplicationState.SOURCE);

        List<ReplicationState> cycle = List.of(ReplicationState.PROMOTING, ReplicationState.SOURCE,
            ReplicationState.DEMOTING, ReplicationState.REPLICA);
        for (ReplicationState desired : cycle) {
            fx.store.updateSpec(KEY, Intents.spec(desired, "netapp-gold", null, Map.of()));
            ReconcileResult result = fx.reconciler.reconcile(KEY);
            assertThat(result.outcome()).as("move to %s", desired).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
            assertThat(fx.store.get(KEY).orElseThrow().status().appliedState()).isEqualTo(desired);
        }

        assertThat(fx.stateMachine.getHistory(KEY.toString()))
            .filteredOn(TransitionRecord::accepted)
            .extracting(TransitionRecord::from, TransitionRecord::to, TransitionRecord::reason)
            .containsSubsequence(
                tuple(ReplicationState.REPLICA, ReplicationState.PROMOTING, "promote"),
                tuple(ReplicationState.PROMOTING, ReplicationState.SOURCE, "ensure"),
                tuple(ReplicationState.SOURCE, ReplicationState.DEMOTING, "demote"),
                tuple(ReplicationState.DEMOTING, ReplicationState.REPLICA, "ensure"));
        assertThat(fx.stateMachine.getHistory(KEY.toString())).allMatch(TransitionRecord::accepted);
    }

    @Test
    void promotedIntentRecoversAfterAFailedStatusRead() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec(ReplicationState.REPLICA, "dell-powerstore", null, Map.of()));
        fx.reconciler.reconcile(KEY);
        fx.store.updateSpec(KEY, Intents.spec(ReplicationState.PROMOTING, "dell-powerstore", null, Map.of()));
        assertThat(fx.reconciler.reconcile(KEY).outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        assertThat(fx.store.get(KEY).orElseThrow().status().currentState()).isEqualTo(ReplicationState.SOURCE);

        counting.failReads = new IllegalStateException("api server unreachable");
        ReconcileResult duringOutage = fx.reconciler.reconcile(KEY);
        assertThat(duringOutage.outcome()).isEqualTo(ReconcileResult.Outcome.FAILED);
        assertThat(OperationKind.of(fx.store.get(KEY).orElseThrow())).isEqualTo(OperationKind.UPDATE);

        counting.failReads = null;
        ReconcileResult recovered = fx.reconciler.reconcile(KEY);

        assertThat(recovered.outcome()).isEqualTo(ReconcileResult.Outcome.SUCCEEDED);
        ReplicationIntent intent = fx.store.get(KEY).orElseThrow();
        assertThat(intent.status().isReady()).isTrue();
        assertThat(intent.status().appliedState()).isEqualTo(ReplicationState.PROMOTING);
        assertThat(backendApi.get(BackendKinds.DELL_REPLICATION_GROUP, "db", "orders").orElseThrow()
            .specString("state")).isEqualTo("source");
        assertThat(fx.stateMachine.getHistory(KEY.toString())).allMatch(TransitionRecord::accepted);
    }

    @Test
    void createThatFailsAfterItsWriteLandedIsStillCleanedUp() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        counting.failAfterWrite = new IllegalStateException("timed out waiting for response");

        ReconcileResult created = fx.reconciler.reconcile(KEY);

        assertThat(created.outcome()).isEqualTo(ReconcileResult.Outcome.FAILED);
        assertThat(backendApi.get(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr")).isPresent();
        assertThat(fx.store.get(KEY).orElseThrow().metadata().finalizers())
            .containsExactly(ReplicationReconciler.FINALIZER);
        assertThat(fx.store.get(KEY).orElseThrow().status().backend()).isEqualTo(Backend.CEPH);

        assertThat(fx.store.requestDeletion(KEY)).isPresent();
        counting.failAfterWrite = null;
        counting.failWrites = null;
        counting.failReads = null;
        ReconcileResult deleted = fx.reconciler.reconcile(KEY);

        assertThat(deleted.outcome()).isEqualTo(ReconcileResult.Outcome.GONE);
        assertThat(backendApi.get(BackendKinds.VOLUME_REPLICATION, "db", "orders-vr")).isEmpty();
        assertThat(fx.store.get(KEY)).isEmpty();
    }

    @Test
    void openBreakerFailsFastWithoutCallingTheBackend() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.breakers.forceOpen("ceph");
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(fx.breakers.getState("ceph")).isEqualTo(CircuitBreaker.State.FORCED_OPEN);
        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.FAILED);
        assertThat(counting.mutations).isEmpty();
        assertThat(fx.store.get(KEY).orElseThrow().status().condition(Condition.READY).orElseThrow().reason())
            .isEqualTo(ReplicationReconciler.REASON_CIRCUIT_OPEN);
    }

    @Test
    void deletionCleansUpTheBackendBeforeReleasingTheIntent() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec("netapp-gold", null));
        fx.reconciler.reconcile(KEY);
        List<Boolean> intentPresentAtDelete = new ArrayList<>();
        counting.onDelete = name -> intentPresentAtDelete.add(fx.store.get(KEY).isPresent());

        assertThat(fx.store.requestDeletion(KEY)).isPresent();
        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.outcome()).isEqualTo(ReconcileResult.Outcome.GONE);
        assertThat(intentPresentAtDelete).containsExactly(true);
        assertThat(backendApi.get(BackendKinds.TRIDENT_MIRROR_RELATIONSHIP, "db", "orders")).isEmpty();
        assertThat(fx.store.get(KEY)).isEmpty();
    }

    @Test
    void failedCleanupKeepsTheFinalizerAndRequeues() {
        InMemoryBackendResourceClient backendApi = allKinds();
        CountingBackendResourceClient counting = new CountingBackendResourceClient(backendApi);
        ReconcilerFixture fx = new ReconcilerFixture(backendApi, counting);
        fx.store.create(KEY, Intents.spec("ceph-rbd", null));
        fx.reconciler.reconcile(KEY);
        fx.store.requestDeletion(KEY);
        counting.failWrites = new IllegalStateException("api server down");

        ReconcileResult result = fx.reconciler.reconcile(KEY);

        assertThat(result.shouldRequeue()).isTrue();
        ReplicationIntent intent = fx.store.get(KEY).orElseThrow();
        assertThat(intent.metadata().hasFinalizer(ReplicationReconciler.FINALIZER)).isTrue();
        assertThat(intent.status().condition(Condition.READY).orElseThrow().reason())
            .isEqualTo(ReplicationReconciler.REASON_CLEANUP_FAILED);
    }

    @Test
    void missingIntentIsGone() {
        ReconcilerFixture fx = new ReconcilerFixture();

        assertThat(fx.reconciler.reconcile(IntentKey.of("db", "missing")).outcome())
            .isEqualTo(ReconcileResult.Outcome.GONE);
    }

    private static InMemoryBackendResourceClient allKinds() {
        return new InMemoryBackendResourceClient(List.of(
            BackendKinds.VOLUME_REPLICATION, BackendKinds.VOLUME_REPLICATION_CLASS,
            BackendKinds.TRIDENT_MIRROR_RELATIONSHIP, BackendKinds.TRIDENT_ACTION_MIRROR_UPDATE,
            BackendKinds.DELL_REPLICATION_GROUP));
    }
}
