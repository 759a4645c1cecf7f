/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.josdk;

import java.time.Duration;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import io.kubestatus.reconcile.ObjectWithConditions;
import io.kubestatus.reconcile.result.ReconcileResult;

/**
 * Converts a finalized resource and its {@link ReconcileResult} into the controls returned
 * from a java-operator-sdk {@code Reconciler}.
 */
public final class StatusUpdateControls {

    private StatusUpdateControls() {
    }

    /**
     * @param resource the resource whose status has been finalized
     * @param result the result of the reconcile
     * @return a status patch rescheduled according to {@code result}
     */
    public static <R extends HasMetadata & ObjectWithConditions> UpdateControl<R> updateControl(R resource, ReconcileResult result) {
        UpdateControl<R> uc = UpdateControl.patchStatus(resource);
        if (result.requeue()) {
            uc.rescheduleAfter(Duration.ZERO);
        }
        else if (!result.requeueAfter().isZero()) {
            uc.rescheduleAfter(result.requeueAfter());
        }
        return uc;
    }

    public static <R extends HasMetadata & ObjectWithConditions> ErrorStatusUpdateControl<R> errorStatusUpdateControl(R resource) {
        return ErrorStatusUpdateControl.patchStatus(resource);
    }
}
