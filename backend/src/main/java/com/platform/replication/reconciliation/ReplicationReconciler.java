package com.platform.replication.reconciliation;

import com.platform.replication.connectors.AdapterRegistry;
import com.platform.replication.connectors.AdapterStatus;
import com.platform.replication.connectors.ReplicationAdapter;
import com.platform.replication.core.CircuitBreakerManager;
import com.platform.replication.core.ErrorClassifier;
import com.platform.replication.core.RetryManager;
import com.platform.replication.discovery.BackendSelector;
import com.platform.replication.discovery.DiscoveryResult;
import com.platform.replication.discovery.DiscoveryService;
import com.platform.replication.error.AdapterException;
import com.platform.replication.error.CircuitOpenException;
import com.platform.replication.error.ControlPlaneException;
import com.platform.replication.error.DiscoveryException;
import com.platform.replication.error.InvalidTransitionException;
import com.platform.replication.error.TranslationException;
import com.platform.replication.error.ValidationException;
import com.platform.replication.model.Backend;
import com.platform.replication.model.Condition;
import com.platform.replication.model.IntentKey;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationStatus;
import com.platform.replication.observability.LoggingConfig;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import com.platform.replication.state.ReplicationState;
import com.platform.replication.state.ReplicationStateMachine;
import com.platform.replication.state.RequiredOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives one intent toward its desired state.
 *
 * Every reconcile is one of CREATE, UPDATE, SYNC or DELETE. Transitions are validated before
 * the backend is contacted; backend calls go through the retry manager and the backend's
 * circuit breaker. Only SYNC is read-only.
 */
@Slf4j
@Component
public class ReplicationReconciler implements KeyReconciler {

    public static final String FINALIZER = "replication.storage.io/finalizer";

    public static final String REASON_SUCCEEDED = "ReconciliationSucceeded";
    public static final String REASON_INVALID_TRANSITION = "InvalidStateTransition";
    public static final String REASON_VALIDATION_FAILED = "ValidationFailed";
    public static final String REASON_BACKEND_SELECTION_FAILED = "BackendSelectionFailed";
    public static final String REASON_NOT_IMPLEMENTED = "NotImplemented";
    public static final String REASON_CIRCUIT_OPEN = "CircuitOpen";
    public static final String REASON_ADAPTER_ERROR = "AdapterError";
    public static final String REASON_CLEANUP_FAILED = "CleanupFailed";
    public static final String REASON_FAILED = "ReconciliationFailed";
    public static final String REASON_STATUS_UPDATED = "StatusUpdated";

    private static final String MESSAGE_SUCCEEDED = "Replication is operating normally";

    private final IntentStore intentStore;
    private final DiscoveryService discoveryService;
    private final BackendSelector backendSelector;
    private final AdapterRegistry adapterRegistry;
    private final IntentValidator intentValidator;
    private final ReplicationStateMachine stateMachine;
    private final RetryManager retryManager;
    private final CircuitBreakerManager circuitBreakerManager;
    private final ErrorClassifier errorClassifier;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final Duration successRequeue;
    private final Duration failureRequeue;

    @Autowired
    public ReplicationReconciler(
            IntentStore intentStore,
            DiscoveryService discoveryService,
            BackendSelector backendSelector,
            AdapterRegistry adapterRegistry,
            IntentValidator intentValidator,
            ReplicationStateMachine stateMachine,
            RetryManager retryManager,
            CircuitBreakerManager circuitBreakerManager,
            ErrorClassifier errorClassifier,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Clock clock,
            @Value("${replication.controller.success-requeue-ms:30000}") long successRequeueMs,
            @Value("${replication.controller.failure-requeue-ms:10000}") long failureRequeueMs) {
        this.intentStore = intentStore;
        this.discoveryService = discoveryService;
        this.backendSelector = backendSelector;
        this.adapterRegistry = adapterRegistry;
        this.intentValidator = intentValidator;
        this.stateMachine = stateMachine;
        this.retryManager = retryManager;
        this.circuitBreakerManager = circuitBreakerManager;
        this.errorClassifier = errorClassifier;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.successRequeue = Duration.ofMillis(successRequeueMs);
        this.failureRequeue = Duration.ofMillis(failureRequeueMs);
    }

    /**
     * Reconcile the intent stored under a key. Never throws for reconcile failures; they are
     * written to the intent's conditions and reflected in the result.
     */
    @Override
    public ReconcileResult reconcile(IntentKey key) {
        Optional<ReplicationIntent> found = intentStore.get(key);
        if (found.isEmpty()) {
            log.debug("Intent {} no longer exists", key);
            return ReconcileResult.gone();
        }
        ReplicationIntent intent = found.get();
        OperationKind kind = OperationKind.of(intent);
        String requestId = key.namespace() + "-" + key.name() + "-" + System.nanoTime();
        long start = System.currentTimeMillis();

        LoggingConfig.setReconcileContext(requestId, key.toString());
        try {
            structuredLogger.reconcile().started(kind.tag());
            log.debug("Reconciling {} as {}", key, kind);

            ReconcileResult result = switch (kind) {
                case DELETE -> reconcileDelete(intent);
                case SYNC -> reconcileSync(intent);
                case CREATE, UPDATE -> reconcileApply(intent, kind, requestId);
            };

            long duration = System.currentTimeMillis() - start;
            metricsRegistry.recordReconcile(kind.tag(), result.outcome().name().toLowerCase(Locale.ROOT), duration);
            if (result.outcome() == ReconcileResult.Outcome.SUCCEEDED || result.outcome() == ReconcileResult.Outcome.GONE) {
                structuredLogger.reconcile().succeeded(kind.tag(), duration);
            } else {
                structuredLogger.reconcile().failed(kind.tag(), result.outcome().name(), result.message(), duration);
            }
            return result;
        } finally {
            LoggingConfig.clearReconcileContext();
        }
    }

    private ReconcileResult reconcileApply(ReplicationIntent intent, OperationKind kind, String requestId) {
        IntentKey key = intent.key();
        ReplicationStatus status = intent.status();
        try {
            DiscoveryResult discovery = discoveryService.discover();
            Backend backend = backendSelector.select(intent, discovery).backend();
            LoggingConfig.setBackendContext(backend.id());
            status = status.withBackend(backend, discovery.backends());

            ReplicationAdapter adapter = adapterRegistry.get(backend);
            intentValidator.validate(intent, adapter);

            // Backends may report a coarser state than was applied, so transitions start from
            // the controller's own record.
            ReplicationState from = status.appliedState();
            ReplicationState to = intent.spec().desiredState();
            RequiredOperation operation = stateMachine.requestTransition(key.toString(), from, to, requestId);
            if (from == null) {
                operation = RequiredOperation.ENSURE;
            } else if (from == to) {
                operation = reassert(to);
            }

            // Attached before the first write so a half-applied create is still cleaned up on delete.
            if (!intent.metadata().hasFinalizer(FINALIZER)) {
                intentStore.addFinalizer(key, FINALIZER);
            }

            RequiredOperation verb = operation;
            String breaker = backend.id();
            retryManager.withRetry(kind.tag() + ":" + key, () ->
                circuitBreakerManager.run(breaker, () -> invoke(adapter, verb, intent)));
            status = status.withAppliedState(to);

            if (from != to) {
                stateMachine.recordTransition(key.toString(), from, to, verb.name().toLowerCase(Locale.ROOT), requestId);
            }

            AdapterStatus observed = readStatus(adapter, intent);
            ReplicationStatus updated = observe(status, observed)
                .withObservedGeneration(intent.metadata().generation())
                .withCondition(Condition.ready(true, REASON_SUCCEEDED, MESSAGE_SUCCEEDED, clock.instant()));
            intentStore.updateStatus(key, updated);
            log.info("Reconciled {} on {} ({})", key, backend, verb);
            return ReconcileResult.succeeded(successRequeue);
        } catch (RuntimeException e) {
            return fail(intent, status, e, reasonFor(e));
        }
    }

    private ReconcileResult reconcileSync(ReplicationIntent intent) {
        ReplicationStatus status = intent.status();
        try {
            Backend backend = status.backend();
            if (backend == null) {
                throw DiscoveryException.noBackendAvailable(intent.key().toString());
            }
            LoggingConfig.setBackendContext(backend.id());
            AdapterStatus observed = readStatus(adapterRegistry.get(backend), intent);
            intentStore.updateStatus(intent.key(), observe(status, observed));
            return ReconcileResult.succeeded(successRequeue);
        } catch (RuntimeException e) {
            return fail(intent, status, e, reasonFor(e));
        }
    }

    private ReconcileResult reconcileDelete(ReplicationIntent intent) {
        IntentKey key = intent.key();
        if (!intent.metadata().hasFinalizer(FINALIZER)) {
            return ReconcileResult.gone();
        }
        try {
            Backend backend = intent.status().backend();
            if (backend != null) {
                LoggingConfig.setBackendContext(backend.id());
                ReplicationAdapter adapter = adapterRegistry.get(backend);
                retryManager.withRetry("delete:" + key, () ->
                    circuitBreakerManager.run(backend.id(), () -> adapter.deleteReplication(intent)));
            }
            intentStore.removeFinalizer(key, FINALIZER);
            structuredLogger.reconcile().cleanup(true, null);
            log.info("Cleaned up backend resources of {}", key);
            return ReconcileResult.gone();
        } catch (RuntimeException e) {
            structuredLogger.reconcile().cleanup(false, e.getMessage());
            ReconcileResult result = fail(intent, intent.status(), e, REASON_CLEANUP_FAILED);
            return result.shouldRequeue() ? result : ReconcileResult.failed(failureRequeue, result.message());
        }
    }

    private void invoke(ReplicationAdapter adapter, RequiredOperation operation, ReplicationIntent intent) {
        switch (operation) {
            case PROMOTE -> adapter.promote(intent);
            case DEMOTE -> adapter.demote(intent);
            case RESYNC -> adapter.resync(intent);
            case ENSURE -> adapter.ensureReplication(intent);
        }
    }

    /**
     * Verb that keeps an already applied state in place. Re-ensuring a promoting or demoting
     * intent would write the transitional state back over the completed role change.
     */
    static RequiredOperation reassert(ReplicationState applied) {
        return switch (applied) {
            case PROMOTING -> RequiredOperation.PROMOTE;
            case DEMOTING -> RequiredOperation.DEMOTE;
            default -> RequiredOperation.ENSURE;
        };
    }

    private AdapterStatus readStatus(ReplicationAdapter adapter, ReplicationIntent intent) {
        return retryManager.withRetry("status:" + intent.key(), () ->
            circuitBreakerManager.call(adapter.backend().id(), () -> adapter.getStatus(intent)));
    }

    private ReplicationStatus observe(ReplicationStatus status, AdapterStatus observed) {
        return status
            .withObserved(observed.state(), observed.mode(), observed.health(), observed.lastSyncTime())
            .withCondition(Condition.synced(true, REASON_STATUS_UPDATED,
                String.format("Current state: %s, mode: %s", observed.state(), observed.mode()), clock.instant()));
    }

    /**
     * Record a failure on the intent. Terminal failures are not requeued.
     */
    private ReconcileResult fail(ReplicationIntent intent, ReplicationStatus status, RuntimeException e, String reason) {
        String message = e instanceof ControlPlaneException cpe ? cpe.describe() : String.valueOf(e.getMessage());
        ErrorClassifier.Disposition disposition = errorClassifier.classify(e);
        if (disposition == ErrorClassifier.Disposition.TERMINAL) {
            log.warn("Reconcile of {} failed permanently: {}", intent.key(), message);
        } else {
            log.error("Reconcile of {} failed: {}", intent.key(), message);
        }

        try {
            intentStore.updateStatus(intent.key(),
                status.withCondition(Condition.ready(false, reason, message, clock.instant())));
        } catch (ControlPlaneException storeError) {
            log.warn("Could not record failure on {}: {}", intent.key(), storeError.getMessage());
        }

        return disposition == ErrorClassifier.Disposition.TERMINAL
            ? ReconcileResult.terminal(message)
            : ReconcileResult.failed(failureRequeue, message);
    }

    static String reasonFor(RuntimeException e) {
        if (e instanceof InvalidTransitionException) {
            return REASON_INVALID_TRANSITION;
        }
        if (e instanceof ValidationException || e instanceof TranslationException) {
            return REASON_VALIDATION_FAILED;
        }
        if (e instanceof DiscoveryException) {
            return REASON_BACKEND_SELECTION_FAILED;
        }
        if (e instanceof CircuitOpenException) {
            return REASON_CIRCUIT_OPEN;
        }
        if (e instanceof AdapterException adapterError) {
            return switch (adapterError.getType()) {
                case NOT_IMPLEMENTED -> REASON_NOT_IMPLEMENTED;
                case VALIDATION, CONFIGURATION -> REASON_VALIDATION_FAILED;
                default -> REASON_ADAPTER_ERROR;
            };
        }
        return REASON_FAILED;
    }

    public Duration successRequeue() {
        return successRequeue;
    }

    public Duration failureRequeue() {
        return failureRequeue;
    }
}
