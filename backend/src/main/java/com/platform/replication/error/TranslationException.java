package com.platform.replication.error;

/**
 * Vocabulary translation failure between the unified model and a backend.
 */
public class TranslationException extends ControlPlaneException {

    private final String backend;
    private final String axis;
    private final String value;

    private TranslationException(ErrorCode errorCode, String backend, String axis, String value, String message) {
        super(errorCode, message);
        this.backend = backend;
        this.axis = axis;
        this.value = value;
    }

    public static TranslationException unsupportedBackend(String backend) {
        return new TranslationException(ErrorCode.UNSUPPORTED_BACKEND, backend, null, null,
            String.format("No translation tables registered for backend '%s'", backend));
    }

    public static TranslationException invalidValue(String backend, String axis, String value) {
        return new TranslationException(ErrorCode.INVALID_VALUE, backend, axis, value,
            String.format("Value '%s' has no %s translation for backend '%s'", value, axis, backend));
    }

    public static TranslationException inconsistentMapping(String backend, String axis, String detail) {
        return new TranslationException(ErrorCode.INCONSISTENT_MAPPING, backend, axis, null,
            String.format("Inconsistent %s mapping for backend '%s': %s", axis, backend, detail));
    }

    public String getBackend() {
        return backend;
    }

    public String getAxis() {
        return axis;
    }

    public String getValue() {
        return value;
    }
}
