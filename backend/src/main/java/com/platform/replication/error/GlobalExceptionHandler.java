package com.platform.replication.error;

import com.platform.replication.observability.LoggingConfig;
import com.platform.replication.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns exceptions from the REST layer into ErrorResponse bodies.
 *
 * Every error is logged and counted; fatal codes are logged at ERROR with the stack trace.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    // ==================== Control Plane Exceptions ====================

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Resource not found: {} ({})", traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = base(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()))
            .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse.ErrorResponseBuilder builder =
            base(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, traceId);
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(ErrorResponse.FieldError.builder()
                .field(ex.getField())
                .message(ex.getMessage())
                .rejectedValue(ex.getRejectedValue())
                .build()));
        }
        return ResponseEntity.badRequest().body(builder.build());
    }

    @ExceptionHandler(ControlPlaneException.class)
    public ResponseEntity<ErrorResponse> handleControlPlaneException(
            ControlPlaneException ex, HttpServletRequest request) {

        String traceId = traceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);

        return ResponseEntity.status(status).body(base(errorCode, ex.getMessage(), status, request, traceId).build());
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = traceId();
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();

        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);

        ErrorResponse response = base(ErrorCode.VALIDATION_ERROR, "Validation failed", HttpStatus.BAD_REQUEST,
                request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        String traceId = traceId();
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ErrorResponse.FieldError.builder()
                .field(fieldName(cv))
                .message(cv.getMessage())
                .rejectedValue(cv.getInvalidValue())
                .build())
            .toList();

        log.warn("[{}] Constraint violation: {} violations", traceId, fieldErrors.size());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);

        ErrorResponse response = base(ErrorCode.INVALID_FIELD_VALUE, "Constraint violation", HttpStatus.BAD_REQUEST,
                request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = base(ErrorCode.INVALID_REQUEST, "Invalid request body", HttpStatus.BAD_REQUEST,
                request, traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);

        ErrorResponse response = base(ErrorCode.MISSING_REQUIRED_FIELD,
                String.format("Missing required parameter: %s", ex.getParameterName()),
                HttpStatus.BAD_REQUEST, request, traceId)
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);

        ErrorResponse response = base(ErrorCode.INVALID_FIELD_VALUE,
                String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
                HttpStatus.BAD_REQUEST, request, traceId)
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);

        ErrorResponse response = base(ErrorCode.INVALID_REQUEST,
                String.format("Method %s not supported for this endpoint", ex.getMethod()),
                HttpStatus.METHOD_NOT_ALLOWED, request, traceId)
            .build();
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);

        ErrorResponse response = base(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    // ==================== Helpers ====================

    private ErrorResponse.ErrorResponseBuilder base(ErrorCode errorCode, String message, HttpStatus status,
                                                    HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    private String traceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }

    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("replication.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, INTENT_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                 UNSUPPORTED_BACKEND, INVALID_VALUE, BACKEND_VALIDATION, STATE_TRANSITION_INVALID ->
                HttpStatus.BAD_REQUEST;
            case CIRCUIT_OPEN, NO_BACKEND_AVAILABLE, BACKEND_CONNECTION ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private String fieldName(ConstraintViolation<?> cv) {
        String path = cv.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot > 0 ? path.substring(lastDot + 1) : path;
    }
}
