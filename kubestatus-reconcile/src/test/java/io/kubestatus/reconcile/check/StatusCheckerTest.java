/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.check;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.kubestatus.reconcile.FakeResource;

import static io.kubestatus.reconcile.ConditionTypes.READY;
import static io.kubestatus.reconcile.ConditionTypes.RECONCILING;
import static io.kubestatus.reconcile.ConditionTypes.STALLED;
import static io.kubestatus.reconcile.TestConditions.falseCondition;
import static io.kubestatus.reconcile.TestConditions.trueCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class StatusCheckerTest {

    private final StatusChecker checker = new StatusChecker(List.of("Degraded"));

    static Stream<Arguments> conformingStatuses() {
        return Stream.of(
                argumentSet("no conditions", FakeResource.withConditions()),
                argumentSet("ready", FakeResource.withConditions(trueCondition(READY, "Succeeded", "ok"))),
                argumentSet("reconciling", FakeResource.withConditions(
                        falseCondition(READY, "Progressing", "working"),
                        trueCondition(RECONCILING, "Progressing", "working"))),
                argumentSet("stalled", FakeResource.withConditions(
                        falseCondition(READY, "Failed", "broken"),
                        trueCondition(STALLED, "Failed", "broken"))),
                argumentSet("ready with healthy negative condition", FakeResource.withConditions(
                        trueCondition(READY, "Succeeded", "ok"),
                        falseCondition("Degraded", "Healthy", "fine"))),
                argumentSet("ready with true positive condition", FakeResource.withConditions(
                        trueCondition(READY, "Succeeded", "ok"),
                        trueCondition("Available", "Serving", "up"))));
    }

    @ParameterizedTest
    @MethodSource
    void conformingStatuses(FakeResource resource) {
        // when
        List<String> violations = checker.check(resource);

        // then
        assertThat(violations).isEmpty();
        assertThatNoException().isThrownBy(() -> checker.checkOrThrow(resource));
    }

    static Stream<Arguments> violatingStatuses() {
        return Stream.of(
                argumentSet("stalled without ready",
                        FakeResource.withConditions(trueCondition(STALLED, "Failed", "broken")),
                        "Ready condition must be present when Stalled or Reconciling is"),
                argumentSet("reconciling without ready",
                        FakeResource.withConditions(falseCondition(RECONCILING, "Done", "done")),
                        "Ready condition must be present when Stalled or Reconciling is"),
                argumentSet("stalled and reconciling",
                        FakeResource.withConditions(
                                falseCondition(READY, "Failed", "broken"),
                                trueCondition(STALLED, "Failed", "broken"),
                                trueCondition(RECONCILING, "Progressing", "working")),
                        "Stalled and Reconciling can not both be True"),
                argumentSet("ready while stalled",
                        FakeResource.withConditions(
                                trueCondition(READY, "Succeeded", "ok"),
                                trueCondition(STALLED, "Failed", "broken")),
                        "Ready=True is inconsistent with abnormal Stalled=True"),
                argumentSet("ready while degraded",
                        FakeResource.withConditions(
                                trueCondition(READY, "Succeeded", "ok"),
                                trueCondition("Degraded", "Overloaded", "slow")),
                        "Ready=True is inconsistent with abnormal Degraded=True"));
    }

    @ParameterizedTest
    @MethodSource
    void violatingStatuses(FakeResource resource, String expectedViolation) {
        // when
        List<String> violations = checker.check(resource);

        // then
        assertThat(violations).contains(expectedViolation);
        assertThatThrownBy(() -> checker.checkOrThrow(resource))
                .isInstanceOf(StatusConformanceException.class)
                .hasMessageContaining(expectedViolation);
    }

    @Test
    void terminalStatusMustObserveCurrentGeneration() {
        // given
        var resource = FakeResource.withConditions(trueCondition(READY, "Succeeded", "ok"));
        resource.setStatusObservedGeneration(FakeResource.GENERATION - 1);

        // when
        List<String> violations = checker.check(resource);

        // then
        assertThat(violations).containsExactly("terminal status observed generation 2 does not match generation 3");
    }

    @Test
    void inProgressStatusMayLagGeneration() {
        // given
        var resource = FakeResource.withConditions(
                falseCondition(READY, "Progressing", "working"),
                trueCondition(RECONCILING, "Progressing", "working"));
        resource.setStatusObservedGeneration(FakeResource.GENERATION - 1);

        // when
        List<String> violations = checker.check(resource);

        // then
        assertThat(violations).isEmpty();
    }

    @Test
    void conditionMustNotBeAheadOfGeneration() {
        // given
        var resource = FakeResource.withGeneration(2L);
        resource.setConditions(List.of(trueCondition(READY, "Succeeded", "ok")));

        // when
        List<String> violations = checker.check(resource);

        // then
        assertThat(violations).containsExactly("Ready observed generation 3 is ahead of generation 2");
    }

    @Test
    void exceptionListsEveryViolation() {
        // given
        var resource = FakeResource.withConditions(
                trueCondition(STALLED, "Failed", "broken"),
                trueCondition(RECONCILING, "Progressing", "working"));

        // when
        // then
        assertThatThrownBy(() -> checker.checkOrThrow(resource))
                .isInstanceOfSatisfying(StatusConformanceException.class,
                        e -> assertThat(e.violations()).hasSize(2));
    }
}
