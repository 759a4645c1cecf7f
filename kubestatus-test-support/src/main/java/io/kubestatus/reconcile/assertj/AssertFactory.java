/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.assertj;

import org.assertj.core.api.InstanceOfAssertFactory;

import io.fabric8.kubernetes.api.model.Condition;

public class AssertFactory {

    private AssertFactory() {
    }

    public static InstanceOfAssertFactory<Condition, ConditionAssert> condition() {
        return new InstanceOfAssertFactory<>(Condition.class, ConditionAssert::assertThat);
    }
}
