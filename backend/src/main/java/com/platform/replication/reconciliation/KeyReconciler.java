package com.platform.replication.reconciliation;

import com.platform.replication.model.IntentKey;

/**
 * Unit of work run by the reconcile queue for one key.
 */
@FunctionalInterface
public interface KeyReconciler {

    ReconcileResult reconcile(IntentKey key);
}
