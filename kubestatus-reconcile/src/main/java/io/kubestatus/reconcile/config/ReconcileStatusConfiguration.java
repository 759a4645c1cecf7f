/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.config;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.kubestatus.reconcile.result.ResultFinalizer;
import io.kubestatus.reconcile.result.SuccessPredicate;
import io.kubestatus.reconcile.summary.ConditionSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The configuration of status finalization for one reconciler.
 *
 * @param successMessage the message of {@code Ready=True} when no summary provides one
 * @param successInterval the requeue interval of a successful reconcile, or null if a successful reconcile doesn't requeue
 * @param fieldOwner the field manager used when persisting the status
 * @param conditionSets the summaries, applied in order
 */
@JsonPropertyOrder({ "successMessage", "successInterval", "fieldOwner", "conditionSets" })
public record ReconcileStatusConfiguration(@JsonProperty(required = true) String successMessage,
                                           @Nullable Duration successInterval,
                                           @Nullable String fieldOwner,
                                           @Nullable List<ConditionSetDefinition> conditionSets) {

    public ReconcileStatusConfiguration {
        if (successMessage == null || successMessage.isBlank()) {
            throw new IllegalConfigurationException("successMessage must be provided");
        }
        if (successInterval != null && (successInterval.isZero() || successInterval.isNegative())) {
            throw new IllegalConfigurationException("successInterval must be positive, was " + successInterval);
        }
    }

    public SuccessPredicate successPredicate() {
        return successInterval == null ? SuccessPredicate.noRequeueOnSuccess() : SuccessPredicate.requeueOnSuccess(successInterval);
    }

    public List<ConditionSet> toConditionSets() {
        return conditionSets == null ? List.of() : conditionSets.stream().map(ConditionSetDefinition::toConditionSet).toList();
    }

    /**
     * @return the owned types of all condition sets
     */
    public List<String> ownedConditions() {
        return ConditionSet.allOwned(toConditionSets());
    }

    public String fieldOwnerOrEmpty() {
        return fieldOwner == null ? "" : fieldOwner;
    }

    public ResultFinalizer newResultFinalizer(Clock clock) {
        return new ResultFinalizer(clock, successPredicate(), successMessage, toConditionSets());
    }
}
