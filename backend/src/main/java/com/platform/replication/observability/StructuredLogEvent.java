package com.platform.replication.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log event schema.
 *
 * Mandatory fields:
 * - timestamp (RFC3339)
 * - level
 * - service
 * - event_type
 *
 * Contextual fields picked up from MDC:
 * - request_id
 * - intent
 * - backend
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuredLogEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private String timestamp;
    private String level;
    private String service;
    private LogEventType eventType;

    private String requestId;
    private String intent;
    private String backend;

    private String operation;
    private String fromState;
    private String toState;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String errorMessage;

    private Map<String, Object> context;

    /**
     * Convert to JSON string for logging.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"error\":\"serialization_failed\"}", eventType);
        }
    }

    /**
     * Create builder with mandatory fields and MDC context.
     */
    public static StructuredLogEventBuilder fromContext(String service, LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .eventType(eventType)
            .requestId(MDC.get(LoggingConfig.MDC_REQUEST_ID))
            .intent(MDC.get(LoggingConfig.MDC_INTENT))
            .backend(MDC.get(LoggingConfig.MDC_BACKEND));
    }
}
