/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

/**
 * An abstract outcome of a reconcile, converted to a concrete {@link ReconcileResult} by a {@link ResultBuilder}.
 */
public enum Result {
    /**
     * Nothing more to do, don't requeue.
     */
    EMPTY,
    /**
     * Requeue immediately.
     */
    REQUEUE,
    /**
     * Reconciled successfully.
     */
    SUCCESS
}
