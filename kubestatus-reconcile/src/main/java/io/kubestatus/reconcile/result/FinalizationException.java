/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

/**
 * The reconciler reported success while its own {@code Ready} condition says otherwise.
 * This is a bug in the reconciler, not a transient condition.
 */
public class FinalizationException extends RuntimeException {

    public FinalizationException(String message) {
        super(message);
    }
}
