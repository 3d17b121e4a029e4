package com.platform.replication.api;

import com.platform.replication.connectors.AdapterRegistry;
import com.platform.replication.model.Backend;
import com.platform.replication.reconciliation.ControllerHealth;
import com.platform.replication.reconciliation.ReconcileQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for controller health checks.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ControllerHealth controllerHealth;
    private final AdapterRegistry adapterRegistry;
    private final ReconcileQueue reconcileQueue;

    public HealthController(ControllerHealth controllerHealth, AdapterRegistry adapterRegistry,
                            ReconcileQueue reconcileQueue) {
        this.controllerHealth = controllerHealth;
        this.adapterRegistry = adapterRegistry;
        this.reconcileQueue = reconcileQueue;
    }

    /**
     * Controller health derived from reconcile activity. 503 when unhealthy.
     */
    @GetMapping
    public ResponseEntity<ControllerHealth.Report> getHealth() {
        ControllerHealth.Report report = controllerHealth.check();
        return ResponseEntity.status(report.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(report);
    }

    @GetMapping("/liveness")
    public Map<String, String> liveness() {
        return Map.of("status", "UP");
    }

    @GetMapping("/readiness")
    public ResponseEntity<Map<String, Object>> readiness() {
        boolean ready = controllerHealth.isReady();
        Map<String, Object> body = Map.of(
            "status", ready ? "UP" : "DOWN",
            "queueDepth", reconcileQueue.depth());
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/adapters")
    public Map<Backend, Boolean> adapters() {
        return adapterRegistry.health();
    }
}
