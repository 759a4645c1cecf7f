/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.time.Clock;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Writes conditions stamped with the current time and the generation of the resource they describe.
 */
public class ConditionMarker {

    private final Clock clock;

    public ConditionMarker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public Condition newCondition(ObjectWithConditions observedGenerationSource,
                                  String type,
                                  ConditionStatus status,
                                  String reason,
                                  String message) {
        return new ConditionBuilder()
                .withType(type)
                .withStatus(status.getValue())
                .withReason(reason)
                .withMessage(message)
                .withObservedGeneration(observedGenerationSource.getGeneration())
                .withLastTransitionTime(Conditions.formatTime(clock.instant()))
                .build();
    }

    public void markTrue(ObjectWithConditions resource, String type, String reason, String message) {
        Conditions.set(resource, newCondition(resource, type, ConditionStatus.TRUE, reason, message));
    }

    public void markFalse(ObjectWithConditions resource, String type, String reason, String message) {
        Conditions.set(resource, newCondition(resource, type, ConditionStatus.FALSE, reason, message));
    }

    public void markUnknown(ObjectWithConditions resource, String type, String reason, String message) {
        Conditions.set(resource, newCondition(resource, type, ConditionStatus.UNKNOWN, reason, message));
    }

    /**
     * Marks the resource as stalled. A stalled resource is by definition not reconciling,
     * so any {@code Reconciling} condition is removed.
     */
    public void markStalled(ObjectWithConditions resource, String reason, String message) {
        Conditions.delete(resource, ConditionTypes.RECONCILING);
        markTrue(resource, ConditionTypes.STALLED, reason, message);
    }

    /**
     * Marks the resource as reconciling, removing any {@code Stalled} condition.
     */
    public void markReconciling(ObjectWithConditions resource, String reason, String message) {
        Conditions.delete(resource, ConditionTypes.STALLED);
        markTrue(resource, ConditionTypes.RECONCILING, reason, message);
    }

    /**
     * Sets the target condition to the given status, copying the reason and message of the source.
     */
    public void markFrom(ObjectWithConditions resource, String targetType, ConditionStatus status, Condition source) {
        Conditions.set(resource, newCondition(resource, targetType, status, nullToEmpty(source.getReason()), nullToEmpty(source.getMessage())));
    }

    private static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
