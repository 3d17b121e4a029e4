package com.platform.replication.error;

/**
 * Base exception for all replication control plane failures.
 * Carries an ErrorCode, which is what retry classification and the REST layer key on.
 */
public abstract class ControlPlaneException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ControlPlaneException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ControlPlaneException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }

    /**
     * Code and message, the form written into status conditions.
     */
    public String describe() {
        return errorCode.getCode() + ": " + getMessage();
    }
}
