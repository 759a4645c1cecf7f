/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.assertj;

import java.util.List;

import org.assertj.core.api.AbstractListAssert;
import org.assertj.core.api.Assertions;
import org.assertj.core.util.Lists;

import io.fabric8.kubernetes.api.model.Condition;

public class ConditionListAssert extends AbstractListAssert<ConditionListAssert, List<Condition>, Condition, ConditionAssert> {
    protected ConditionListAssert(List<Condition> o) {
        super(o, ConditionListAssert.class);
    }

    public static ConditionListAssert assertThat(List<Condition> actual) {
        return new ConditionListAssert(actual);
    }

    @Override
    protected ConditionAssert toAssert(Condition value, String description) {
        return ConditionAssert.assertThat(value).as(description);
    }

    @Override
    protected ConditionListAssert newAbstractIterableAssert(Iterable<? extends Condition> iterable) {
        return assertThat(Lists.newArrayList(iterable));
    }

    public ConditionListAssert containsOnlyTypes(String... types) {
        isNotNull();
        var actualTypes = actual.stream().map(Condition::getType).toList();
        Assertions.assertThat(actualTypes).as("unexpected types in list").containsOnly(types);
        return this;
    }

    public ConditionListAssert doesNotContainType(String type) {
        isNotNull();
        var actualTypes = actual.stream().map(Condition::getType).toList();
        Assertions.assertThat(actualTypes).as("expected no condition with type=" + type).doesNotContain(type);
        return this;
    }

    public ConditionAssert singleOfType(String type) {
        isNotNull();
        var ofType = actual.stream().filter(condition -> type.equals(condition.getType())).toList();
        Assertions.assertThat(ofType).as("expected exactly one condition with type=" + type).hasSize(1);
        return ConditionAssert.assertThat(ofType.get(0)).as("type=" + type);
    }
}
