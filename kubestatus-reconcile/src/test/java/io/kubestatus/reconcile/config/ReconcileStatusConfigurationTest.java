/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.config;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.kubestatus.reconcile.result.SuccessType;
import io.kubestatus.reconcile.summary.ConditionSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconcileStatusConfigurationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));

    @Test
    void shouldRequireSuccessMessage() {
        assertThatThrownBy(() -> new ReconcileStatusConfiguration("", null, null, null))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("successMessage must be provided");
    }

    @Test
    void shouldRejectNegativeInterval() {
        Duration interval = Duration.ofSeconds(-1);
        assertThatThrownBy(() -> new ReconcileStatusConfiguration("ok", interval, null, null))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("successInterval must be positive, was PT-1S");
    }

    @Test
    void shouldRequeueOnSuccessWhenIntervalGiven() {
        // given
        var configuration = new ReconcileStatusConfiguration("ok", Duration.ofMinutes(1), null, null);

        // when
        var finalizer = configuration.newResultFinalizer(CLOCK);

        // then
        assertThat(finalizer.successType()).isEqualTo(SuccessType.REQUEUE_ON_SUCCESS);
        assertThat(finalizer.conditionSets()).isEmpty();
    }

    @Test
    void shouldNotRequeueOnSuccessWithoutInterval() {
        // given
        var configuration = new ReconcileStatusConfiguration("ok", null, null, null);

        // when
        var finalizer = configuration.newResultFinalizer(CLOCK);

        // then
        assertThat(finalizer.successType()).isEqualTo(SuccessType.NO_REQUEUE_ON_SUCCESS);
    }

    @Test
    void shouldCollectOwnedConditionsAcrossSets() {
        // given
        var configuration = new ReconcileStatusConfiguration("ok", null, "owner", List.of(
                new ConditionSetDefinition("Ready", List.of("Ready", "Available"), List.of("Available"), null),
                new ConditionSetDefinition("Available", List.of("Available", "Reachable"), List.of("Reachable"), null)));

        // when
        List<String> owned = configuration.ownedConditions();

        // then
        assertThat(owned).containsExactly("Ready", "Available", "Reachable");
        assertThat(configuration.fieldOwnerOrEmpty()).isEqualTo("owner");
    }

    @Test
    void shouldDefaultFieldOwnerToEmpty() {
        var configuration = new ReconcileStatusConfiguration("ok", null, null, null);
        assertThat(configuration.fieldOwnerOrEmpty()).isEmpty();
        assertThat(configuration.ownedConditions()).isEmpty();
    }

    @Test
    void shouldConvertDefinitionToConditionSet() {
        // given
        var definition = new ConditionSetDefinition("Ready", null, List.of("Available", "Degraded"), List.of("Degraded"));

        // when
        ConditionSet conditionSet = definition.toConditionSet();

        // then
        assertThat(conditionSet.target()).isEqualTo("Ready");
        assertThat(conditionSet.owned()).isEmpty();
        assertThat(conditionSet.summarize()).containsExactly("Available", "Degraded");
        assertThat(conditionSet.negativePolarity()).containsExactly("Degraded");
    }

    @Test
    void shouldRejectNegativePolarityOutsideSummary() {
        // given
        var configuration = new ReconcileStatusConfiguration("ok", null, null, List.of(
                new ConditionSetDefinition("Ready", null, List.of("Available"), List.of("Degraded"))));

        // when
        // then
        assertThatThrownBy(configuration::toConditionSets)
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Invalid condition set for Ready: negative polarity types [Degraded] are not summarized into Ready")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectSelfSummary() {
        var definition = new ConditionSetDefinition("Ready", null, List.of("Ready"), null);
        assertThatThrownBy(definition::toConditionSet)
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("cannot be summarized into itself");
    }
}
