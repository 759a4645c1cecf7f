/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.assertj;

import java.util.List;

import io.fabric8.kubernetes.api.model.Condition;

public class ConditionAssertions {

    // Static factory should not be instantiated.
    private ConditionAssertions() {
    }

    public static ConditionAssert assertThat(Condition actual) {
        return ConditionAssert.assertThat(actual);
    }

    public static ConditionListAssert assertThat(List<Condition> actual) {
        return ConditionListAssert.assertThat(actual);
    }
}
