package com.platform.replication.api;

import com.platform.replication.error.ResourceNotFoundException;
import com.platform.replication.model.IntentKey;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.model.ReplicationStatus;
import com.platform.replication.reconciliation.IntentStore;
import com.platform.replication.reconciliation.IntentValidator;
import com.platform.replication.reconciliation.ReconcileQueue;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for submitting and inspecting replication intents.
 */
@Slf4j
@RestController
@RequestMapping("/api/intents")
public class IntentController {

    private final IntentStore intentStore;
    private final IntentValidator intentValidator;
    private final ReconcileQueue reconcileQueue;

    public IntentController(IntentStore intentStore, IntentValidator intentValidator, ReconcileQueue reconcileQueue) {
        this.intentStore = intentStore;
        this.intentValidator = intentValidator;
        this.reconcileQueue = reconcileQueue;
    }

    @GetMapping
    public List<ReplicationIntent> listIntents() {
        return intentStore.list();
    }

    @PostMapping
    public ResponseEntity<ReplicationIntent> createIntent(@Valid @RequestBody IntentRequests.CreateIntentRequest request) {
        var spec = request.getSpec().toSpec();
        intentValidator.validate(spec);
        ReplicationIntent created = intentStore.create(IntentKey.of(request.getNamespace(), request.getName()), spec);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{namespace}/{name}")
    public ReplicationIntent getIntent(@PathVariable String namespace, @PathVariable String name) {
        return require(IntentKey.of(namespace, name));
    }

    @PutMapping("/{namespace}/{name}")
    public ReplicationIntent updateIntent(
            @PathVariable String namespace,
            @PathVariable String name,
            @Valid @RequestBody IntentRequests.SpecRequest request) {
        var spec = request.toSpec();
        intentValidator.validate(spec);
        return intentStore.updateSpec(IntentKey.of(namespace, name), spec);
    }

    /**
     * Request deletion. The intent stays visible until backend cleanup has finished.
     */
    @DeleteMapping("/{namespace}/{name}")
    public ResponseEntity<Map<String, Object>> deleteIntent(@PathVariable String namespace, @PathVariable String name) {
        IntentKey key = IntentKey.of(namespace, name);
        boolean pending = intentStore.requestDeletion(key).isPresent();
        return ResponseEntity.accepted().body(Map.of(
            "intent", key.toString(),
            "finalized", !pending));
    }

    @GetMapping("/{namespace}/{name}/status")
    public ReplicationStatus getStatus(@PathVariable String namespace, @PathVariable String name) {
        return require(IntentKey.of(namespace, name)).status();
    }

    /**
     * Queue an immediate reconcile.
     */
    @PostMapping("/{namespace}/{name}/reconcile")
    public ResponseEntity<Map<String, Object>> triggerReconcile(@PathVariable String namespace, @PathVariable String name) {
        IntentKey key = IntentKey.of(namespace, name);
        require(key);
        reconcileQueue.add(key);
        log.info("Manual reconcile queued for {}", key);
        return ResponseEntity.accepted().body(Map.of("intent", key.toString(), "queued", true));
    }

    private ReplicationIntent require(IntentKey key) {
        return intentStore.get(key).orElseThrow(() -> ResourceNotFoundException.intent(key.toString()));
    }
}
