package com.platform.replication.reconciliation;

import com.platform.replication.error.ResourceConflictException;
import com.platform.replication.error.ResourceNotFoundException;
import com.platform.replication.model.IntentKey;
import com.platform.replication.model.IntentMetadata;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationSpec;
import com.platform.replication.model.ReplicationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local intent store. Writes to one key are atomic; change events are published
 * after the write is visible.
 */
@Slf4j
@Component
public class InMemoryIntentStore implements IntentStore {

    private final Map<IntentKey, ReplicationIntent> intents = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public InMemoryIntentStore(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public Optional<ReplicationIntent> get(IntentKey key) {
        return Optional.ofNullable(intents.get(key));
    }

    @Override
    public List<ReplicationIntent> list() {
        return intents.values().stream()
            .sorted(Comparator.comparing(i -> i.key().toString()))
            .toList();
    }

    @Override
    public ReplicationIntent create(IntentKey key, ReplicationSpec spec) {
        ReplicationIntent intent = new ReplicationIntent(
            IntentMetadata.create(key.namespace(), key.name(), clock.instant()), spec, ReplicationStatus.empty());
        if (intents.putIfAbsent(key, intent) != null) {
            throw new ResourceConflictException("ReplicationIntent", key.toString());
        }
        log.info("Created intent {}", key);
        eventPublisher.publishEvent(new IntentChangedEvent(key, IntentChangedEvent.Type.CREATED));
        return intent;
    }

    @Override
    public ReplicationIntent updateSpec(IntentKey key, ReplicationSpec spec) {
        ReplicationIntent current = require(key);
        if (current.spec().equals(spec)) {
            return current;
        }
        ReplicationIntent updated = modify(key, intent -> intent.spec().equals(spec)
            ? intent
            : intent.withSpec(spec).withMetadata(intent.metadata().nextGeneration()));
        log.info("Updated desired fields of {} (generation {})", key, updated.metadata().generation());
        eventPublisher.publishEvent(new IntentChangedEvent(key, IntentChangedEvent.Type.SPEC_UPDATED));
        return updated;
    }

    @Override
    public ReplicationIntent updateStatus(IntentKey key, ReplicationStatus status) {
        return modify(key, intent -> intent.withStatus(status));
    }

    @Override
    public ReplicationIntent addFinalizer(IntentKey key, String finalizer) {
        return modify(key, intent -> intent.withMetadata(intent.metadata().withFinalizer(finalizer)));
    }

    @Override
    public Optional<ReplicationIntent> removeFinalizer(IntentKey key, String finalizer) {
        ReplicationIntent result = intents.computeIfPresent(key, (k, intent) -> {
            IntentMetadata metadata = intent.metadata().withoutFinalizer(finalizer);
            if (metadata.isDeletionRequested() && metadata.finalizers().isEmpty()) {
                return null;
            }
            return intent.withMetadata(metadata);
        });
        if (result == null) {
            log.info("Finalized intent {}", key);
        }
        return Optional.ofNullable(result);
    }

    @Override
    public Optional<ReplicationIntent> requestDeletion(IntentKey key) {
        ReplicationIntent current = require(key);
        if (current.metadata().isDeletionRequested()) {
            return Optional.of(current);
        }
        ReplicationIntent result = intents.computeIfPresent(key, (k, intent) -> intent.metadata().finalizers().isEmpty()
            ? null
            : intent.withMetadata(intent.metadata().markedForDeletion(clock.instant())));
        if (result == null) {
            log.info("Deleted intent {} (no finalizers)", key);
        } else {
            log.info("Deletion requested for {}", key);
            eventPublisher.publishEvent(new IntentChangedEvent(key, IntentChangedEvent.Type.DELETION_REQUESTED));
        }
        return Optional.ofNullable(result);
    }

    private ReplicationIntent require(IntentKey key) {
        return get(key).orElseThrow(() -> ResourceNotFoundException.intent(key.toString()));
    }

    private ReplicationIntent modify(IntentKey key, UnaryOperator<ReplicationIntent> change) {
        ReplicationIntent updated = intents.computeIfPresent(key, (k, intent) -> change.apply(intent));
        if (updated == null) {
            throw ResourceNotFoundException.intent(key.toString());
        }
        return updated;
    }
}
