package com.platform.replication.error;

/**
 * Backend discovery or selection failure.
 */
public class DiscoveryException extends ControlPlaneException {

    private DiscoveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DiscoveryException probeFailed(String backend, Throwable cause) {
        return new DiscoveryException(ErrorCode.PROBE_FAILED,
            String.format("Probe for backend '%s' failed: %s", backend, cause.getMessage()), cause);
    }

    public static DiscoveryException noBackendAvailable(String intent) {
        return new DiscoveryException(ErrorCode.NO_BACKEND_AVAILABLE,
            String.format("No available backend could be resolved for %s", intent), null);
    }

    /**
     * The intent names a backend that is unknown or not available.
     */
    public static DiscoveryException hintNotSatisfiable(String hint, String reason) {
        return new DiscoveryException(ErrorCode.BACKEND_CONFIGURATION,
            String.format("Backend hint '%s' cannot be used: %s", hint, reason), null);
    }
}
