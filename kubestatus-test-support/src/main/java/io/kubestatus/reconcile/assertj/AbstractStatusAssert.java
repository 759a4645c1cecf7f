/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.assertj;

import java.util.List;
import java.util.function.Function;

import org.assertj.core.api.AbstractLongAssert;
import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.Assertions;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Base for assertions on a status carrying an observed generation and a list of conditions.
 *
 * @param <A> the type of the status
 * @param <S> the type of the assertion
 */
public abstract class AbstractStatusAssert<A, S extends AbstractStatusAssert<A, S>> extends AbstractObjectAssert<S, A> {
    private final Function<A, Long> observedGenerationAccessor;
    private final Function<A, List<Condition>> conditionsAccessor;

    protected AbstractStatusAssert(
                                   A actual,
                                   Class<S> selfType,
                                   Function<A, Long> observedGenerationAccessor,
                                   Function<A, List<Condition>> conditionsAccessor) {
        super(actual, selfType);
        this.observedGenerationAccessor = observedGenerationAccessor;
        this.conditionsAccessor = conditionsAccessor;
    }

    public AbstractLongAssert<?> observedGeneration() {
        return Assertions.assertThat(observedGenerationAccessor.apply(actual));
    }

    public S hasObservedGeneration(Long observedGeneration) {
        observedGeneration().isEqualTo(observedGeneration);
        return myself;
    }

    public S hasNoObservedGeneration() {
        observedGeneration().isNull();
        return myself;
    }

    public S hasObservedGenerationInSyncWithMetadataOf(HasMetadata thing) {
        return hasObservedGeneration(thing.getMetadata().getGeneration());
    }

    public ConditionListAssert conditionList() {
        return ConditionListAssert.assertThat(conditionsAccessor.apply(actual));
    }

    public ConditionAssert singleCondition() {
        return conditionList().singleElement(AssertFactory.condition());
    }

    public ConditionAssert conditionOfType(String type) {
        return conditionList().singleOfType(type);
    }
}
