/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

/**
 * The condition types which have a fleet-wide meaning, regardless of the resource that carries them.
 */
public final class ConditionTypes {

    /**
     * The outcome of the last reconcile. {@code True} when the resource is fully reconciled.
     */
    public static final String READY = "Ready";

    /**
     * Abnormal-true. The resource can not make progress without external intervention.
     */
    public static final String STALLED = "Stalled";

    /**
     * Abnormal-true. A reconcile is in progress.
     */
    public static final String RECONCILING = "Reconciling";

    private ConditionTypes() {
    }
}
