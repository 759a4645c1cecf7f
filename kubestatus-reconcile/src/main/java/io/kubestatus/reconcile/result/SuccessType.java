/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

/**
 * The two ways a reconciler can signal success through its result.
 */
public enum SuccessType {

    /**
     * Success requeues at a fixed positive interval; an empty result is not a success.
     */
    REQUEUE_ON_SUCCESS,

    /**
     * Success carries no requeue at all.
     */
    NO_REQUEUE_ON_SUCCESS;

    /**
     * Probes the predicate with an empty result and no error.
     * @param predicate a pure success predicate
     * @return the success type the predicate implements
     */
    public static SuccessType determine(SuccessPredicate predicate) {
        return predicate.isSuccess(ReconcileResult.empty(), null) ? NO_REQUEUE_ON_SUCCESS : REQUEUE_ON_SUCCESS;
    }
}
