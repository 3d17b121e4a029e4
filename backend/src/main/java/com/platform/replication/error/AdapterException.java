package com.platform.replication.error;

/**
 * Failure reported by a backend adapter.
 */
public class AdapterException extends ControlPlaneException {

    private final Type type;
    private final String backend;
    private final String operation;
    private final String resource;

    public AdapterException(Type type, String backend, String operation, String resource, String message) {
        this(type, backend, operation, resource, message, null);
    }

    public AdapterException(Type type, String backend, String operation, String resource,
                            String message, Throwable cause) {
        super(type.errorCode, String.format("[%s] %s %s: %s", backend, operation, resource, message), cause);
        this.type = type;
        this.backend = backend;
        this.operation = operation;
        this.resource = resource;
    }

    public static AdapterException notImplemented(String backend, String operation, String resource) {
        return new AdapterException(Type.NOT_IMPLEMENTED, backend, operation, resource,
            "backend has no native equivalent for this operation");
    }

    public static AdapterException operationFailed(String backend, String operation, String resource, Throwable cause) {
        return new AdapterException(Type.OPERATION, backend, operation, resource, cause.getMessage(), cause);
    }

    public Type getType() {
        return type;
    }

    public String getBackend() {
        return backend;
    }

    public String getOperation() {
        return operation;
    }

    public String getResource() {
        return resource;
    }

    /**
     * Adapter failure kinds, each backed by one error code.
     */
    public enum Type {
        CONFIGURATION(ErrorCode.BACKEND_CONFIGURATION),
        CONNECTION(ErrorCode.BACKEND_CONNECTION),
        VALIDATION(ErrorCode.BACKEND_VALIDATION),
        OPERATION(ErrorCode.BACKEND_OPERATION_FAILED),
        TIMEOUT(ErrorCode.BACKEND_TIMEOUT),
        PERMISSION(ErrorCode.BACKEND_PERMISSION),
        RESOURCE(ErrorCode.BACKEND_RESOURCE),
        NOT_IMPLEMENTED(ErrorCode.NOT_IMPLEMENTED);

        private final ErrorCode errorCode;

        Type(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }

        public ErrorCode errorCode() {
            return errorCode;
        }
    }
}
