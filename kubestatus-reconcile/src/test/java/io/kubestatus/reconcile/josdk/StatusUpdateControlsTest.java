/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.josdk;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import io.kubestatus.reconcile.FakeResource;
import io.kubestatus.reconcile.result.ReconcileResult;

import static io.kubestatus.reconcile.ConditionTypes.READY;
import static io.kubestatus.reconcile.TestConditions.trueCondition;
import static org.assertj.core.api.Assertions.assertThat;

class StatusUpdateControlsTest {

    private final FakeResource resource = FakeResource.withConditions(trueCondition(READY, "Succeeded", "ok"));

    @Test
    void shouldPatchStatusWithoutRescheduleForEmptyResult() {
        // when
        UpdateControl<FakeResource> updateControl = StatusUpdateControls.updateControl(resource, ReconcileResult.empty());

        // then
        assertThat(updateControl.isPatchStatus()).isTrue();
        assertThat(updateControl.getResource()).containsSame(resource);
        assertThat(updateControl.getScheduleDelay()).isEmpty();
    }

    @Test
    void shouldRescheduleImmediatelyOnRequeue() {
        // when
        UpdateControl<FakeResource> updateControl = StatusUpdateControls.updateControl(resource, ReconcileResult.requeueNow());

        // then
        assertThat(updateControl.isPatchStatus()).isTrue();
        assertThat(updateControl.getScheduleDelay()).contains(0L);
    }

    @Test
    void shouldRescheduleAfterRequeueInterval() {
        // when
        UpdateControl<FakeResource> updateControl = StatusUpdateControls.updateControl(resource, ReconcileResult.requeueAfter(Duration.ofSeconds(30)));

        // then
        assertThat(updateControl.getScheduleDelay()).contains(30_000L);
    }

    @Test
    void shouldPatchStatusOnError() {
        // when
        ErrorStatusUpdateControl<FakeResource> errorControl = StatusUpdateControls.errorStatusUpdateControl(resource);

        // then
        assertThat(errorControl.getResource()).containsSame(resource);
    }
}
