/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

/**
 * Maps an abstract {@link Result} to the requeue directive of a particular reconciler.
 */
@FunctionalInterface
public interface ResultBuilder {

    ReconcileResult build(Result result);
}
