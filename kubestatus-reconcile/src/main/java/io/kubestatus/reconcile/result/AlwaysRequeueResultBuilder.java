/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Duration;
import java.util.Objects;

/**
 * For reconcilers which requeue periodically once successful.
 * Pairs with {@link SuccessPredicate#requeueOnSuccess(Duration)} for the same interval, see {@link #successPredicate()}.
 */
public class AlwaysRequeueResultBuilder implements ResultBuilder {

    private final Duration requeueAfter;

    public AlwaysRequeueResultBuilder(Duration requeueAfter) {
        Objects.requireNonNull(requeueAfter);
        if (requeueAfter.isZero() || requeueAfter.isNegative()) {
            throw new IllegalArgumentException("requeueAfter must be positive");
        }
        this.requeueAfter = requeueAfter;
    }

    @Override
    public ReconcileResult build(Result result) {
        return switch (result) {
            case SUCCESS -> ReconcileResult.requeueAfter(requeueAfter);
            case REQUEUE -> ReconcileResult.requeueNow();
            case EMPTY -> ReconcileResult.empty();
        };
    }

    public SuccessPredicate successPredicate() {
        return SuccessPredicate.requeueOnSuccess(requeueAfter);
    }

    public Duration requeueAfter() {
        return requeueAfter;
    }
}
