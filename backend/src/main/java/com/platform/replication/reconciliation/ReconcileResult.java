package com.platform.replication.reconciliation;

import java.time.Duration;

/**
 * Outcome of one reconcile.
 *
 * @param requeueAfter when to reconcile the key again; null means wait for the next change
 */
public record ReconcileResult(Outcome outcome, Duration requeueAfter, String message) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        /** Failed in a way only a change to the intent can fix. */
        TERMINAL,
        /** The intent no longer exists. */
        GONE
    }

    public static ReconcileResult succeeded(Duration requeueAfter) {
        return new ReconcileResult(Outcome.SUCCEEDED, requeueAfter, "ok");
    }

    public static ReconcileResult failed(Duration requeueAfter, String message) {
        return new ReconcileResult(Outcome.FAILED, requeueAfter, message);
    }

    public static ReconcileResult terminal(String message) {
        return new ReconcileResult(Outcome.TERMINAL, null, message);
    }

    public static ReconcileResult gone() {
        return new ReconcileResult(Outcome.GONE, null, "intent no longer exists");
    }

    public boolean shouldRequeue() {
        return requeueAfter != null;
    }
}
