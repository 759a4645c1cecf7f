/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Duration;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SuccessTypeTest {

    private static final Duration REQUEUE_PERIOD = Duration.ofMinutes(1);

    static Stream<Arguments> determine() {
        return Stream.of(
                Arguments.argumentSet("requeuing reconciler", SuccessPredicate.requeueOnSuccess(REQUEUE_PERIOD), SuccessType.REQUEUE_ON_SUCCESS),
                Arguments.argumentSet("no requeue reconciler", SuccessPredicate.noRequeueOnSuccess(), SuccessType.NO_REQUEUE_ON_SUCCESS),
                Arguments.argumentSet("custom predicate accepting an empty result",
                        (SuccessPredicate) (result, error) -> error == null && !result.requeue(), SuccessType.NO_REQUEUE_ON_SUCCESS));
    }

    @ParameterizedTest
    @MethodSource
    void determine(SuccessPredicate predicate, SuccessType expected) {
        assertThat(SuccessType.determine(predicate)).isEqualTo(expected);
    }

    @Test
    void requeueOnSuccessAcceptsOnlyTheSuccessInterval() {
        var predicate = SuccessPredicate.requeueOnSuccess(REQUEUE_PERIOD);

        assertThat(predicate.isSuccess(ReconcileResult.requeueAfter(REQUEUE_PERIOD), null)).isTrue();
        assertThat(predicate.isSuccess(ReconcileResult.requeueAfter(Duration.ofSeconds(5)), null)).isFalse();
        assertThat(predicate.isSuccess(new ReconcileResult(true, REQUEUE_PERIOD), null)).isFalse();
        assertThat(predicate.isSuccess(ReconcileResult.empty(), null)).isFalse();
        assertThat(predicate.isSuccess(ReconcileResult.requeueAfter(REQUEUE_PERIOD), new RuntimeException("boom"))).isFalse();
    }

    @Test
    void noRequeueOnSuccessAcceptsOnlyAnEmptyResult() {
        var predicate = SuccessPredicate.noRequeueOnSuccess();

        assertThat(predicate.isSuccess(ReconcileResult.empty(), null)).isTrue();
        assertThat(predicate.isSuccess(ReconcileResult.requeueNow(), null)).isFalse();
        assertThat(predicate.isSuccess(ReconcileResult.requeueAfter(REQUEUE_PERIOD), null)).isFalse();
        assertThat(predicate.isSuccess(ReconcileResult.empty(), new RuntimeException("boom"))).isFalse();
    }

    @Test
    void requeueOnSuccessNeedsPositiveInterval() {
        assertThatThrownBy(() -> SuccessPredicate.requeueOnSuccess(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SuccessPredicate.requeueOnSuccess(Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
