/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Clock;
import java.util.Optional;

import io.kubestatus.reconcile.ConditionMarker;
import io.kubestatus.reconcile.ConditionStatus;
import io.kubestatus.reconcile.Conditions;
import io.kubestatus.reconcile.ObjectWithConditions;

import static io.kubestatus.reconcile.ConditionTypes.READY;

/**
 * Marks a resource as being reconciled, before the outcome of the reconcile is known.
 */
public class ProgressiveStatus {

    private final ConditionMarker marker;

    public ProgressiveStatus(Clock clock) {
        this.marker = new ConditionMarker(clock);
    }

    /**
     * Sets {@code Reconciling=True}, removing any {@code Stalled}. {@code Ready} becomes (or stays) {@code Unknown} with the same reason and
     * message if it is absent or {@code Unknown}, or if it is {@code True} but an out-of-band change
     * invalidated it. A {@code Ready=False} is always left alone.
     *
     * @param drift true if the reconcile was triggered by drift from the last known-good state
     * @param resource the resource
     * @param reason the reason
     * @param messageFormat the message, a {@link String#format(String, Object...)} format when arguments are given
     * @param messageArgs the message arguments
     */
    public void markProgressing(boolean drift,
                                ObjectWithConditions resource,
                                String reason,
                                String messageFormat,
                                Object... messageArgs) {
        String message = messageArgs.length == 0 ? messageFormat : String.format(messageFormat, messageArgs);
        marker.markReconciling(resource, reason, message);

        Optional<ConditionStatus> ready = Conditions.status(resource, READY);
        boolean invalidated = ready.isEmpty()
                || ready.get() == ConditionStatus.UNKNOWN
                || (drift && ready.get() == ConditionStatus.TRUE);
        if (invalidated) {
            marker.markUnknown(resource, READY, reason, message);
        }
    }
}
