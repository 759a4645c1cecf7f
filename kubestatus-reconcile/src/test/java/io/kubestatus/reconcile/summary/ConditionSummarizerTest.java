/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.summary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import io.kubestatus.reconcile.ConditionMarker;
import io.kubestatus.reconcile.FakeResource;
import io.kubestatus.reconcile.assertj.ConditionListAssert;

import static io.kubestatus.reconcile.TestConditions.falseCondition;
import static io.kubestatus.reconcile.TestConditions.trueCondition;
import static io.kubestatus.reconcile.TestConditions.unknownCondition;
import static org.assertj.core.api.Assertions.assertThat;

class ConditionSummarizerTest {

    private static final Clock TEST_CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));

    private static final ConditionSet READY_SET = ConditionSet.builder("Ready")
            .summarizeNegative("Stalled", "Reconciling", "FetchFailed")
            .summarize("Synced", "Healthy")
            .build();

    private final ConditionSummarizer summarizer = new ConditionSummarizer(new ConditionMarker(TEST_CLOCK));

    static Stream<Arguments> summarize() {
        return Stream.of(
                Arguments.argumentSet("abnormal negative polarity wins over normal positive",
                        List.of(trueCondition("FetchFailed", "FetchError", "no route"), trueCondition("Synced", "Synced", "in sync")),
                        "False", "FetchError", "no route"),
                Arguments.argumentSet("abnormal positive polarity makes target false",
                        List.of(falseCondition("Synced", "OutOfSync", "drifted"), trueCondition("Healthy", "Healthy", "fine")),
                        "False", "OutOfSync", "drifted"),
                Arguments.argumentSet("first abnormal in priority order wins, not first in list",
                        List.of(falseCondition("Synced", "OutOfSync", "drifted"), trueCondition("Reconciling", "Progressing", "working")),
                        "False", "Progressing", "working"),
                Arguments.argumentSet("normal positive polarity preferred for reason",
                        List.of(falseCondition("FetchFailed", "Fetched", "fetched ok"), trueCondition("Healthy", "Healthy", "fine")),
                        "True", "Healthy", "fine"),
                Arguments.argumentSet("normal negative polarity used when no positive is present",
                        List.of(falseCondition("FetchFailed", "Fetched", "fetched ok")),
                        "True", "Fetched", "fetched ok"),
                Arguments.argumentSet("unknown ignored when a normal condition exists",
                        List.of(unknownCondition("Synced", "Checking", "checking"), trueCondition("Healthy", "Healthy", "fine")),
                        "True", "Healthy", "fine"),
                Arguments.argumentSet("only unknown makes target unknown",
                        List.of(unknownCondition("Healthy", "Checking", "probing"), unknownCondition("Synced", "Checking", "comparing")),
                        "Unknown", "Checking", "comparing"));
    }

    @ParameterizedTest
    @MethodSource
    void summarize(List<Condition> conditions, String expectedStatus, String expectedReason, String expectedMessage) {
        // given
        var resource = FakeResource.withConditions(conditions.toArray(new Condition[0]));

        // when
        summarizer.summarize(resource, READY_SET);

        // then
        ConditionListAssert.assertThat(resource.getConditions())
                .singleOfType("Ready")
                .hasStatusReasonAndMessage(expectedStatus, expectedReason, expectedMessage)
                .hasObservedGeneration(FakeResource.GENERATION)
                .hasLastTransitionTime("1970-01-01T00:00:00Z");
    }

    @Test
    void shouldNotTouchTargetWhenNothingToSummarize() {
        // given
        var ready = falseCondition("Ready", "Failed", "set by business logic");
        var resource = FakeResource.withConditions(ready, trueCondition("Unrelated", "Whatever", ""));

        // when
        summarizer.summarize(resource, READY_SET);

        // then
        ConditionListAssert.assertThat(resource.getConditions()).singleOfType("Ready").isEqualTo(ready);
    }

    @Test
    void shouldOverwriteTargetFromSummary() {
        // given
        var resource = FakeResource.withConditions(
                falseCondition("Ready", "Failed", "stale"),
                trueCondition("Synced", "Synced", "in sync"));

        // when
        summarizer.summarize(resource, READY_SET);

        // then
        ConditionListAssert.assertThat(resource.getConditions()).singleOfType("Ready").isReadyTrue("Synced", "in sync");
    }

    @Test
    void shouldOnlyConsultOwnedTypes() {
        // given
        var set = ConditionSet.builder("Ready")
                .owned("Healthy")
                .summarize("Synced", "Healthy")
                .build();
        var resource = FakeResource.withConditions(
                falseCondition("Synced", "OutOfSync", "not ours"),
                trueCondition("Healthy", "Healthy", "fine"));

        // when
        summarizer.summarize(resource, set);

        // then
        ConditionListAssert.assertThat(resource.getConditions()).singleOfType("Ready").isReadyTrue("Healthy", "fine");
    }

    @Test
    void shouldIgnoreUnrecognisedStatus() {
        // given
        var odd = new ConditionBuilder(falseCondition("Synced", "Odd", "")).withStatus("Maybe").build();
        var resource = FakeResource.withConditions(odd);

        // when
        summarizer.summarize(resource, READY_SET);

        // then
        ConditionListAssert.assertThat(resource.getConditions()).doesNotContainType("Ready");
    }

    @Test
    void shouldApplySetsInOrder() {
        // given
        var healthy = ConditionSet.builder("Healthy").summarizeNegative("Degraded").build();
        var ready = ConditionSet.builder("Ready").summarize("Healthy").build();
        var resource = FakeResource.withConditions(trueCondition("Degraded", "ReplicaDown", "1 of 3 replicas down"));

        // when
        summarizer.summarizeAll(resource, List.of(healthy, ready));

        // then
        var conditions = ConditionListAssert.assertThat(resource.getConditions());
        conditions.singleOfType("Healthy").hasStatusReasonAndMessage("False", "ReplicaDown", "1 of 3 replicas down");
        conditions.singleOfType("Ready").isReadyFalse("ReplicaDown", "1 of 3 replicas down");
    }

    @Test
    void shouldGiveSameResultWhenRepeated() {
        // given
        var resource = FakeResource.withConditions(falseCondition("Synced", "OutOfSync", "drifted"));
        summarizer.summarize(resource, READY_SET);
        List<Condition> first = List.copyOf(resource.getConditions());

        // when
        summarizer.summarize(resource, READY_SET);

        // then
        assertThat(resource.getConditions()).isEqualTo(first);
    }
}
