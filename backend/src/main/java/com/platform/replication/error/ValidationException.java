package com.platform.replication.error;

/**
 * Semantic validation failure of an intent. Never retried.
 */
public class ValidationException extends ControlPlaneException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE,
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException missing(String field) {
        return new ValidationException(field, null, "value is required");
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
