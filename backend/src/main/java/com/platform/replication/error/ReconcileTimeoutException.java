package com.platform.replication.error;

import java.time.Duration;

/**
 * Reconcile abandoned because it was cancelled or ran past its deadline.
 */
public class ReconcileTimeoutException extends ControlPlaneException {

    private ReconcileTimeoutException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ReconcileTimeoutException timedOut(String key, Duration timeout) {
        return new ReconcileTimeoutException(ErrorCode.RECONCILE_TIMEOUT,
            String.format("Reconcile of %s exceeded %s", key, timeout), null);
    }

    public static ReconcileTimeoutException interrupted(String operation, InterruptedException cause) {
        return new ReconcileTimeoutException(ErrorCode.RECONCILE_INTERRUPTED,
            String.format("%s interrupted", operation), cause);
    }
}
