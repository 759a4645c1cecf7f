/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.util.Comparator;

/**
 * Utilities for combining the results of several sub-reconciles.
 */
public final class ReconcileResults {

    /**
     * Orders results by how soon they requeue: an immediate requeue first, then the shortest interval,
     * then no requeue at all.
     */
    public static final Comparator<ReconcileResult> SOONEST_REQUEUE_FIRST = Comparator
            .comparing((ReconcileResult result) -> !result.requeue())
            .thenComparing(result -> result.requeueAfter().isZero())
            .thenComparing(ReconcileResult::requeueAfter);

    private ReconcileResults() {
    }

    /**
     * @return whichever of the two results requeues soonest, {@code a} if they are equivalent
     */
    public static ReconcileResult lowestRequeuing(ReconcileResult a, ReconcileResult b) {
        return SOONEST_REQUEUE_FIRST.compare(b, a) < 0 ? b : a;
    }
}
