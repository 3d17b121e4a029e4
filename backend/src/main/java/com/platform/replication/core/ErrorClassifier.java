package com.platform.replication.core;

import com.platform.replication.error.ControlPlaneException;
import com.platform.replication.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides how each failure is treated by the retry loop and the reconcile queue.
 *
 * The table below is exhaustive over ErrorCode; a code added without a disposition fails
 * construction.
 */
@Component
public class ErrorClassifier {

    public enum Disposition {
        /** Retried with backoff inside the retry loop, then requeued. */
        RETRYABLE,
        /** Not retried inside the loop, but the intent is requeued with the failure interval. */
        FAIL_FAST,
        /** Written to status and left until the caller changes the intent. */
        TERMINAL
    }

    private static final Map<ErrorCode, Disposition> TABLE;

    static {
        Map<ErrorCode, Disposition> table = new EnumMap<>(ErrorCode.class);

        table.put(ErrorCode.VALIDATION_ERROR, Disposition.TERMINAL);
        table.put(ErrorCode.INVALID_REQUEST, Disposition.TERMINAL);
        table.put(ErrorCode.MISSING_REQUIRED_FIELD, Disposition.TERMINAL);
        table.put(ErrorCode.INVALID_FIELD_VALUE, Disposition.TERMINAL);

        table.put(ErrorCode.UNSUPPORTED_BACKEND, Disposition.TERMINAL);
        table.put(ErrorCode.INVALID_VALUE, Disposition.TERMINAL);
        table.put(ErrorCode.INCONSISTENT_MAPPING, Disposition.TERMINAL);

        table.put(ErrorCode.RESOURCE_NOT_FOUND, Disposition.TERMINAL);
        table.put(ErrorCode.INTENT_NOT_FOUND, Disposition.TERMINAL);
        table.put(ErrorCode.RESOURCE_CONFLICT, Disposition.RETRYABLE);

        table.put(ErrorCode.PROBE_FAILED, Disposition.RETRYABLE);
        table.put(ErrorCode.NO_BACKEND_AVAILABLE, Disposition.TERMINAL);
        table.put(ErrorCode.BACKEND_CONFIGURATION, Disposition.TERMINAL);
        table.put(ErrorCode.BACKEND_CONNECTION, Disposition.RETRYABLE);
        table.put(ErrorCode.BACKEND_VALIDATION, Disposition.TERMINAL);
        table.put(ErrorCode.BACKEND_OPERATION_FAILED, Disposition.RETRYABLE);
        table.put(ErrorCode.BACKEND_TIMEOUT, Disposition.RETRYABLE);
        table.put(ErrorCode.BACKEND_PERMISSION, Disposition.TERMINAL);
        table.put(ErrorCode.BACKEND_RESOURCE, Disposition.RETRYABLE);
        table.put(ErrorCode.NOT_IMPLEMENTED, Disposition.TERMINAL);
        table.put(ErrorCode.CIRCUIT_OPEN, Disposition.FAIL_FAST);

        table.put(ErrorCode.STATE_TRANSITION_INVALID, Disposition.TERMINAL);
        table.put(ErrorCode.RECONCILE_TIMEOUT, Disposition.RETRYABLE);
        table.put(ErrorCode.RECONCILE_INTERRUPTED, Disposition.FAIL_FAST);

        table.put(ErrorCode.INTERNAL_ERROR, Disposition.FAIL_FAST);
        table.put(ErrorCode.UNEXPECTED_ERROR, Disposition.FAIL_FAST);
        table.put(ErrorCode.CONFIGURATION_ERROR, Disposition.TERMINAL);

        for (ErrorCode code : ErrorCode.values()) {
            if (!table.containsKey(code)) {
                throw new IllegalStateException("No retry disposition for " + code);
            }
        }
        TABLE = Collections.unmodifiableMap(table);
    }

    public Disposition classify(ErrorCode code) {
        return TABLE.get(code);
    }

    /**
     * Exceptions outside the control plane hierarchy are treated as transport faults.
     */
    public Disposition classify(Throwable error) {
        if (error instanceof ControlPlaneException cpe) {
            return classify(cpe.getErrorCode());
        }
        if (error instanceof InterruptedException) {
            return Disposition.FAIL_FAST;
        }
        return Disposition.RETRYABLE;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error) == Disposition.RETRYABLE;
    }

    public boolean isTerminal(Throwable error) {
        return classify(error) == Disposition.TERMINAL;
    }

    public Map<ErrorCode, Disposition> table() {
        return TABLE;
    }
}
