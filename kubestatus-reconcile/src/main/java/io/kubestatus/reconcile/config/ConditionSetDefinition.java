/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.config;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.kubestatus.reconcile.summary.ConditionSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The configured form of a {@link ConditionSet}.
 *
 * @param target the condition type computed by the summary
 * @param owned the condition types owned by the reconciler
 * @param summarize the summarized condition types, highest priority first
 * @param negativePolarity the summarized types for which {@code True} is abnormal
 */
@JsonPropertyOrder({ "target", "owned", "summarize", "negativePolarity" })
public record ConditionSetDefinition(@JsonProperty(required = true) String target,
                                     @Nullable List<String> owned,
                                     @JsonProperty(required = true) List<String> summarize,
                                     @Nullable List<String> negativePolarity) {

    public ConditionSetDefinition {
        Objects.requireNonNull(target);
        Objects.requireNonNull(summarize);
    }

    public ConditionSet toConditionSet() {
        try {
            return ConditionSet.of(target,
                    owned == null ? List.of() : owned,
                    summarize,
                    negativePolarity == null ? List.of() : negativePolarity);
        }
        catch (IllegalArgumentException e) {
            throw new IllegalConfigurationException("Invalid condition set for " + target + ": " + e.getMessage(), e);
        }
    }
}
