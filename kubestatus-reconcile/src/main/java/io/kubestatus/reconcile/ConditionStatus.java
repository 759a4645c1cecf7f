/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The values of {@code status} on a {@link io.fabric8.kubernetes.api.model.Condition}.
 * Declaration order is significant: when two conditions of the same type compete, the
 * status declared later is preferred.
 */
public enum ConditionStatus {
    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");

    private final String value;

    ConditionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean is(@Nullable String status) {
        return value.equals(status);
    }

    public static Optional<ConditionStatus> fromValue(@Nullable String status) {
        for (ConditionStatus candidate : values()) {
            if (candidate.is(status)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
