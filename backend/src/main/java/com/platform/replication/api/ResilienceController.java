package com.platform.replication.api;

import com.platform.replication.core.CircuitBreakerManager;
import com.platform.replication.core.RetryManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for circuit breakers and in-flight retries.
 */
@Slf4j
@RestController
@RequestMapping("/api/resilience")
public class ResilienceController {

    private final CircuitBreakerManager circuitBreakerManager;
    private final RetryManager retryManager;

    public ResilienceController(CircuitBreakerManager circuitBreakerManager, RetryManager retryManager) {
        this.circuitBreakerManager = circuitBreakerManager;
        this.retryManager = retryManager;
    }

    @GetMapping("/circuit-breakers")
    public Map<String, CircuitBreakerManager.CircuitBreakerStatus> getCircuitBreakers() {
        return circuitBreakerManager.getAllStates();
    }

    @GetMapping("/circuit-breakers/{name}")
    public CircuitBreakerManager.CircuitBreakerStatus getCircuitBreaker(@PathVariable String name) {
        return circuitBreakerManager.getStatus(name);
    }

    @PostMapping("/circuit-breakers/{name}/force-open")
    public CircuitBreakerManager.CircuitBreakerStatus forceOpen(@PathVariable String name) {
        log.warn("Forcing circuit breaker {} open", name);
        circuitBreakerManager.forceOpen(name);
        return circuitBreakerManager.getStatus(name);
    }

    @PostMapping("/circuit-breakers/{name}/force-close")
    public CircuitBreakerManager.CircuitBreakerStatus forceClose(@PathVariable String name) {
        log.warn("Forcing circuit breaker {} closed", name);
        circuitBreakerManager.forceClose(name);
        return circuitBreakerManager.getStatus(name);
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    public CircuitBreakerManager.CircuitBreakerStatus reset(@PathVariable String name) {
        circuitBreakerManager.reset(name);
        return circuitBreakerManager.getStatus(name);
    }

    @GetMapping("/retries")
    public Map<String, Integer> getRetries() {
        return retryManager.getAllRetryCounts();
    }
}
