/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.summary;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Condition;

import io.kubestatus.reconcile.ConditionMarker;
import io.kubestatus.reconcile.ConditionStatus;
import io.kubestatus.reconcile.Conditions;
import io.kubestatus.reconcile.ObjectWithConditions;

/**
 * Reduces the conditions named by a {@link ConditionSet} to its target condition.
 * <ul>
 *     <li>The first abnormal condition, in priority order, makes the target {@code False} with its reason and message.</li>
 *     <li>Otherwise the target becomes {@code True}, taking reason and message from the first normal
 *     positive polarity condition, or failing that the first normal condition.</li>
 *     <li>If every present condition is {@code Unknown} the target becomes {@code Unknown}.</li>
 *     <li>If none of the summarized types are present the target is not touched.</li>
 * </ul>
 * The result only depends on the conditions present and on the set.
 */
public class ConditionSummarizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConditionSummarizer.class);

    private final ConditionMarker marker;

    public ConditionSummarizer(ConditionMarker marker) {
        this.marker = Objects.requireNonNull(marker);
    }

    /**
     * Applies the sets strictly in order, so a set may summarize the target of an earlier one.
     * @param resource the resource
     * @param conditionSets the sets
     */
    public void summarizeAll(ObjectWithConditions resource, List<ConditionSet> conditionSets) {
        for (ConditionSet conditionSet : conditionSets) {
            summarize(resource, conditionSet);
        }
    }

    public void summarize(ObjectWithConditions resource, ConditionSet conditionSet) {
        Condition firstNormalPositive = null;
        Condition firstNormal = null;
        Condition firstUnknown = null;
        for (String type : conditionSet.summarize()) {
            if (!conditionSet.mayConsult(type)) {
                continue;
            }
            Optional<Condition> present = Conditions.get(resource, type);
            if (present.isEmpty()) {
                continue;
            }
            Condition condition = present.get();
            Optional<ConditionStatus> status = ConditionStatus.fromValue(condition.getStatus());
            if (status.isEmpty()) {
                continue;
            }
            Polarity polarity = conditionSet.polarity(type);
            if (polarity.isAbnormal(status.get())) {
                LOGGER.debug("{} summarized as False from abnormal {}={}", conditionSet.target(), type, condition.getStatus());
                marker.markFrom(resource, conditionSet.target(), ConditionStatus.FALSE, condition);
                return;
            }
            if (status.get() == ConditionStatus.UNKNOWN) {
                firstUnknown = firstUnknown == null ? condition : firstUnknown;
            }
            else {
                firstNormal = firstNormal == null ? condition : firstNormal;
                if (polarity == Polarity.POSITIVE && firstNormalPositive == null) {
                    firstNormalPositive = condition;
                }
            }
        }
        if (firstNormal != null) {
            marker.markFrom(resource, conditionSet.target(), ConditionStatus.TRUE, firstNormalPositive != null ? firstNormalPositive : firstNormal);
        }
        else if (firstUnknown != null) {
            marker.markFrom(resource, conditionSet.target(), ConditionStatus.UNKNOWN, firstUnknown);
        }
    }
}
