package com.platform.replication.config;

import com.platform.replication.core.CircuitBreakerManager;
import com.platform.replication.core.ErrorClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker registry shared by all backend calls.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            ErrorClassifier errorClassifier,
            MeterRegistry meterRegistry,
            @Value("${replication.circuit-breaker.failure-threshold:5}") int failureThreshold,
            @Value("${replication.circuit-breaker.success-threshold:2}") int successThreshold,
            @Value("${replication.circuit-breaker.recovery-timeout-ms:30000}") long recoveryTimeoutMs) {

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(CircuitBreakerManager.breakerConfig(
            failureThreshold, successThreshold, Duration.ofMillis(recoveryTimeoutMs), errorClassifier));

        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);

        log.info("Circuit breakers: open after {} consecutive failures, half-open after {}ms, close after {} successes",
            failureThreshold, recoveryTimeoutMs, successThreshold);
        return registry;
    }
}
