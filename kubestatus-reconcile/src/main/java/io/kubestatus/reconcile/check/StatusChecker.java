/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.check;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.fabric8.kubernetes.api.model.Condition;

import io.kubestatus.reconcile.Conditions;
import io.kubestatus.reconcile.ObjectWithConditions;

import static io.kubestatus.reconcile.ConditionTypes.READY;
import static io.kubestatus.reconcile.ConditionTypes.RECONCILING;
import static io.kubestatus.reconcile.ConditionTypes.STALLED;

/**
 * Checks a status against the conventions consumers of {@code Ready}, {@code Stalled} and
 * {@code Reconciling} rely on. {@code Stalled} and {@code Reconciling} are always treated as
 * negative polarity, in addition to any types given at construction.
 */
public class StatusChecker {

    private final Set<String> negativePolarity;

    public StatusChecker(Collection<String> negativePolarity) {
        Set<String> types = new LinkedHashSet<>(List.of(STALLED, RECONCILING));
        types.addAll(negativePolarity);
        this.negativePolarity = Set.copyOf(types);
    }

    /**
     * @param resource the resource
     * @return the violations found, empty if the status conforms
     */
    public List<String> check(ObjectWithConditions resource) {
        List<String> violations = new ArrayList<>();
        boolean triadPresent = Conditions.has(resource, STALLED) || Conditions.has(resource, RECONCILING);
        if (triadPresent && !Conditions.has(resource, READY)) {
            violations.add(READY + " condition must be present when " + STALLED + " or " + RECONCILING + " is");
        }
        if (Conditions.isStalled(resource) && Conditions.isReconciling(resource)) {
            violations.add(STALLED + " and " + RECONCILING + " can not both be True");
        }
        if (Conditions.isReady(resource)) {
            negativePolarity.stream()
                    .filter(type -> Conditions.isTrue(resource, type))
                    .sorted()
                    .forEach(type -> violations.add(READY + "=True is inconsistent with abnormal " + type + "=True"));
        }
        Long generation = resource.getGeneration();
        Long observedGeneration = resource.getStatusObservedGeneration();
        if ((Conditions.isReady(resource) || Conditions.isStalled(resource))
                && observedGeneration != null
                && !Objects.equals(observedGeneration, generation)) {
            violations.add("terminal status observed generation " + observedGeneration + " does not match generation " + generation);
        }
        if (generation != null) {
            for (Condition condition : resource.getConditions()) {
                if (condition.getObservedGeneration() != null && condition.getObservedGeneration() > generation) {
                    violations.add(condition.getType() + " observed generation " + condition.getObservedGeneration() + " is ahead of generation " + generation);
                }
            }
        }
        return violations;
    }

    /**
     * @param resource the resource
     * @throws StatusConformanceException if any violation is found
     */
    public void checkOrThrow(ObjectWithConditions resource) {
        List<String> violations = check(resource);
        if (!violations.isEmpty()) {
            throw new StatusConformanceException(violations);
        }
    }
}
