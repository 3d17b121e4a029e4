package com.platform.replication.error;

/**
 * Fast failure raised instead of calling a backend whose breaker is open.
 */
public class CircuitOpenException extends ControlPlaneException {

    private final String breakerName;

    public CircuitOpenException(String breakerName, Throwable cause) {
        super(ErrorCode.CIRCUIT_OPEN,
            String.format("Circuit breaker '%s' is open, call not permitted", breakerName), cause);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
