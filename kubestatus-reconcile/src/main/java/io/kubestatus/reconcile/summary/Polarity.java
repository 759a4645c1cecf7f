/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.summary;

import io.kubestatus.reconcile.ConditionStatus;

/**
 * Which status of a condition type represents a problem.
 */
public enum Polarity {

    /**
     * {@code False} is abnormal, for example {@code Ready} or {@code ArtifactInStorage}.
     */
    POSITIVE(ConditionStatus.TRUE, ConditionStatus.FALSE),

    /**
     * {@code True} is abnormal, for example {@code Stalled} or {@code FetchFailed}.
     */
    NEGATIVE(ConditionStatus.FALSE, ConditionStatus.TRUE);

    private final ConditionStatus normal;
    private final ConditionStatus abnormal;

    Polarity(ConditionStatus normal, ConditionStatus abnormal) {
        this.normal = normal;
        this.abnormal = abnormal;
    }

    public boolean isAbnormal(ConditionStatus status) {
        return abnormal == status;
    }

    public boolean isNormal(ConditionStatus status) {
        return normal == status;
    }
}
