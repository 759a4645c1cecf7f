/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Duration;
import java.util.Objects;

/**
 * The requeue directive returned by one reconcile attempt.
 *
 * @param requeue whether an immediate requeue is requested
 * @param requeueAfter the interval after which to requeue, {@link Duration#ZERO} for none
 */
public record ReconcileResult(boolean requeue, Duration requeueAfter) {

    private static final ReconcileResult EMPTY = new ReconcileResult(false, Duration.ZERO);
    private static final ReconcileResult REQUEUE = new ReconcileResult(true, Duration.ZERO);

    public ReconcileResult {
        Objects.requireNonNull(requeueAfter, "requeueAfter cannot be null");
        if (requeueAfter.isNegative()) {
            throw new IllegalArgumentException("requeueAfter cannot be negative");
        }
    }

    /**
     * @return a result which does not ask for a requeue
     */
    public static ReconcileResult empty() {
        return EMPTY;
    }

    /**
     * @return a result asking for an immediate requeue
     */
    public static ReconcileResult requeueNow() {
        return REQUEUE;
    }

    public static ReconcileResult requeueAfter(Duration interval) {
        return new ReconcileResult(false, interval);
    }

    public boolean isEmpty() {
        return !requeue && requeueAfter.isZero();
    }

    /**
     * @return true if any requeue, immediate or delayed, is requested
     */
    public boolean requeueRequested() {
        return !isEmpty();
    }
}
