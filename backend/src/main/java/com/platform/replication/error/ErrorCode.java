package com.platform.replication.error;

/**
 * Standardized error codes for the replication control plane.
 * Each error has a unique code that clients and operators can act on.
 *
 * Format: CP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Translation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Discovery and backend errors
 * - 5xx: Reconciliation errors
 * - 9xx: Internal errors (unexpected)
 *
 * Whether a code is retried is decided by ErrorClassifier, not by its category.
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("CP-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CP-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("CP-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CP-103", "Invalid field value", ErrorCategory.RECOVERABLE),

    // ==================== Translation Errors (2xx) ====================

    UNSUPPORTED_BACKEND("CP-200", "Unsupported backend", ErrorCategory.RECOVERABLE),
    INVALID_VALUE("CP-201", "Value has no translation for backend", ErrorCategory.RECOVERABLE),
    INCONSISTENT_MAPPING("CP-202", "Translation tables are inconsistent", ErrorCategory.FATAL),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("CP-300", "Resource not found", ErrorCategory.RECOVERABLE),
    INTENT_NOT_FOUND("CP-301", "Replication intent not found", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("CP-310", "Resource conflict", ErrorCategory.RECOVERABLE),

    // ==================== Discovery / Backend Errors (4xx) ====================

    PROBE_FAILED("CP-400", "Backend discovery probe failed", ErrorCategory.RECOVERABLE),
    NO_BACKEND_AVAILABLE("CP-401", "No backend available for intent", ErrorCategory.RECOVERABLE),
    BACKEND_CONFIGURATION("CP-410", "Backend configuration error", ErrorCategory.RECOVERABLE),
    BACKEND_CONNECTION("CP-411", "Backend connection failed", ErrorCategory.RECOVERABLE),
    BACKEND_VALIDATION("CP-412", "Backend rejected the configuration", ErrorCategory.RECOVERABLE),
    BACKEND_OPERATION_FAILED("CP-413", "Backend operation failed", ErrorCategory.RECOVERABLE),
    BACKEND_TIMEOUT("CP-414", "Backend operation timed out", ErrorCategory.RECOVERABLE),
    BACKEND_PERMISSION("CP-415", "Backend permission denied", ErrorCategory.RECOVERABLE),
    BACKEND_RESOURCE("CP-416", "Backend resource unavailable", ErrorCategory.RECOVERABLE),
    NOT_IMPLEMENTED("CP-417", "Operation not implemented by backend", ErrorCategory.RECOVERABLE),
    CIRCUIT_OPEN("CP-420", "Circuit breaker is open", ErrorCategory.RECOVERABLE),

    // ==================== Reconciliation Errors (5xx) ====================

    STATE_TRANSITION_INVALID("CP-520", "Invalid state transition", ErrorCategory.RECOVERABLE),
    RECONCILE_TIMEOUT("CP-530", "Reconcile timed out", ErrorCategory.RECOVERABLE),
    RECONCILE_INTERRUPTED("CP-531", "Reconcile interrupted", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("CP-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("CP-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("CP-902", "Configuration error", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Caller or operator can fix the input, or the condition clears on its own.
         */
        RECOVERABLE,

        /**
         * Defect or broken deployment, requires intervention.
         */
        FATAL
    }
}
