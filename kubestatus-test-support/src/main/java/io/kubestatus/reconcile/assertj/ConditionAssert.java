/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.assertj;

import org.assertj.core.api.AbstractLongAssert;
import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.AbstractStringAssert;
import org.assertj.core.api.Assertions;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;

public class ConditionAssert extends AbstractObjectAssert<ConditionAssert, Condition> {

    private static final String READY = "Ready";
    private static final String STALLED = "Stalled";
    private static final String RECONCILING = "Reconciling";

    protected ConditionAssert(Condition o) {
        super(o, ConditionAssert.class);
    }

    public static ConditionAssert assertThat(Condition actual) {
        return new ConditionAssert(actual);
    }

    public AbstractLongAssert<?> observedGeneration() {
        return Assertions.assertThat(actual.getObservedGeneration());
    }

    public ConditionAssert hasObservedGeneration(Long expected) {
        observedGeneration().isEqualTo(expected);
        return this;
    }

    public ConditionAssert hasObservedGenerationInSyncWithMetadataOf(HasMetadata thing) {
        hasObservedGeneration(thing.getMetadata().getGeneration());
        return this;
    }

    public AbstractStringAssert<?> type() {
        return Assertions.assertThat(actual.getType()).as("type");
    }

    public ConditionAssert hasType(String expected) {
        type().isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> status() {
        return Assertions.assertThat(actual.getStatus()).as("status of " + actual.getType());
    }

    public ConditionAssert hasStatus(String expected) {
        status().isEqualTo(expected);
        return this;
    }

    public ConditionAssert isTrue() {
        return hasStatus("True");
    }

    public ConditionAssert isFalse() {
        return hasStatus("False");
    }

    public ConditionAssert isUnknown() {
        return hasStatus("Unknown");
    }

    public AbstractStringAssert<?> reason() {
        return Assertions.assertThat(actual.getReason()).as("reason of " + actual.getType());
    }

    public ConditionAssert hasReason(String expected) {
        reason().isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> message() {
        return Assertions.assertThat(actual.getMessage()).as("message of " + actual.getType());
    }

    public ConditionAssert hasMessage(String expected) {
        message().isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> lastTransitionTime() {
        return Assertions.assertThat(actual.getLastTransitionTime());
    }

    public ConditionAssert hasLastTransitionTime(String expected) {
        lastTransitionTime().isEqualTo(expected);
        return this;
    }

    public ConditionAssert hasStatusReasonAndMessage(String status, String reason, String message) {
        hasStatus(status);
        hasReason(reason);
        hasMessage(message);
        return this;
    }

    public ConditionAssert isReadyTrue(String reason, String message) {
        hasType(READY);
        return hasStatusReasonAndMessage("True", reason, message);
    }

    public ConditionAssert isReadyFalse(String reason, String message) {
        hasType(READY);
        return hasStatusReasonAndMessage("False", reason, message);
    }

    public ConditionAssert isReadyUnknown(String reason, String message) {
        hasType(READY);
        return hasStatusReasonAndMessage("Unknown", reason, message);
    }

    public ConditionAssert isStalledTrue(String reason, String message) {
        hasType(STALLED);
        return hasStatusReasonAndMessage("True", reason, message);
    }

    public ConditionAssert isReconcilingTrue(String reason, String message) {
        hasType(RECONCILING);
        return hasStatusReasonAndMessage("True", reason, message);
    }
}
