/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Duration;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides whether the outcome of a reconcile attempt is a terminal success.
 * Implementations must be pure: they are also invoked with fabricated results to
 * discover the {@link SuccessType}.
 */
@FunctionalInterface
public interface SuccessPredicate {

    boolean isSuccess(ReconcileResult result, @Nullable Exception error);

    /**
     * Success is no error, no immediate requeue and a requeue at exactly the given interval.
     * @param successInterval the periodic requeue interval of a successful reconcile
     * @return the predicate
     */
    static SuccessPredicate requeueOnSuccess(Duration successInterval) {
        Objects.requireNonNull(successInterval);
        if (successInterval.isZero() || successInterval.isNegative()) {
            throw new IllegalArgumentException("success interval must be positive");
        }
        return (result, error) -> error == null && !result.requeue() && successInterval.equals(result.requeueAfter());
    }

    /**
     * Success is no error and no requeue of any kind.
     * @return the predicate
     */
    static SuccessPredicate noRequeueOnSuccess() {
        return (result, error) -> error == null && result.isEmpty();
    }
}
