package com.platform.replication.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured logger for control plane milestones.
 *
 * Milestones go through here as JSON on the structured.* loggers;
 * diagnostic chatter stays on the class loggers.
 */
@Component
public class StructuredLogger {

    private final String serviceName;

    public StructuredLogger(@Value("${spring.application.name:replication-control-plane}") String serviceName) {
        this.serviceName = serviceName;
    }

    public ReconcileLogger reconcile() {
        return new ReconcileLogger(serviceName);
    }

    public ResilienceLogger resilience() {
        return new ResilienceLogger(serviceName);
    }

    public DiscoveryLogger discovery() {
        return new DiscoveryLogger(serviceName);
    }

    // ==================== RECONCILE LOGGER ====================

    public static class ReconcileLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.reconcile");
        private final String service;

        ReconcileLogger(String service) {
            this.service = service;
        }

        public void started(String operationKind) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILE_STARTED, "DEBUG")
                .operation(operationKind)
                .build();
            log.debug(event.toJson());
        }

        public void succeeded(String operationKind, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILE_SUCCEEDED, "INFO")
                .operation(operationKind)
                .success(true)
                .durationMs(durationMs)
                .build();
            log.info(event.toJson());
        }

        public void failed(String operationKind, String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILE_FAILED, "ERROR")
                .operation(operationKind)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .build();
            log.error(event.toJson());
        }

        public void timedOut(String intent, long timeoutMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.RECONCILE_TIMED_OUT, "WARN")
                .intent(intent)
                .success(false)
                .durationMs(timeoutMs)
                .build();
            log.warn(event.toJson());
        }

        public void backendSelected(String backend, String rule) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.BACKEND_SELECTED, "INFO")
                .backend(backend)
                .context(Map.of("rule", rule))
                .build();
            log.info(event.toJson());
        }

        public void transition(String from, String to, boolean accepted, String reason) {
            LogEventType type = accepted ? LogEventType.TRANSITION_ACCEPTED : LogEventType.TRANSITION_REJECTED;
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, type, accepted ? "INFO" : "WARN")
                .fromState(from)
                .toState(to)
                .success(accepted)
                .context(Map.of("reason", reason))
                .build();
            if (accepted) {
                log.info(event.toJson());
            } else {
                log.warn(event.toJson());
            }
        }

        public void cleanup(boolean success, String errorMessage) {
            StructuredLogEvent.StructuredLogEventBuilder builder = StructuredLogEvent.fromContext(service,
                    success ? LogEventType.CLEANUP_COMPLETED : LogEventType.CLEANUP_FAILED,
                    success ? "INFO" : "ERROR")
                .success(success);
            if (success) {
                log.info(builder.build().toJson());
            } else {
                log.error(builder.errorMessage(errorMessage).build().toJson());
            }
        }
    }

    // ==================== RESILIENCE LOGGER ====================

    public static class ResilienceLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.resilience");
        private final String service;

        ResilienceLogger(String service) {
            this.service = service;
        }

        public void breakerStateChanged(String breaker, String fromState, String toState) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.CIRCUIT_BREAKER_STATE_CHANGED, "WARN")
                .operation(breaker)
                .fromState(fromState)
                .toState(toState)
                .build();
            log.warn(event.toJson());
        }
    }

    // ==================== DISCOVERY LOGGER ====================

    public static class DiscoveryLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.discovery");
        private final String service;

        DiscoveryLogger(String service) {
            this.service = service;
        }

        public void completed(Map<String, Object> statuses, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.DISCOVERY_COMPLETED, "INFO")
                .success(true)
                .durationMs(durationMs)
                .context(statuses)
                .build();
            log.info(event.toJson());
        }

        public void probeFailed(String backend, String errorMessage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, LogEventType.DISCOVERY_PROBE_FAILED, "WARN")
                .backend(backend)
                .success(false)
                .errorMessage(errorMessage)
                .build();
            log.warn(event.toJson());
        }
    }
}
