/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.fabric8.kubernetes.api.model.Condition;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A status carrying the fields the engine manages. Custom resource status classes extend this.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "observedGeneration", "lastHandledReconcileAt", "conditions" })
public class ConditionedStatus {

    private @Nullable Long observedGeneration;
    private @Nullable String lastHandledReconcileAt;
    private List<Condition> conditions = new ArrayList<>();

    public @Nullable Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(@Nullable Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    public @Nullable String getLastHandledReconcileAt() {
        return lastHandledReconcileAt;
    }

    public void setLastHandledReconcileAt(@Nullable String lastHandledReconcileAt) {
        this.lastHandledReconcileAt = lastHandledReconcileAt;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(@Nullable List<Condition> conditions) {
        this.conditions = conditions == null ? new ArrayList<>() : new ArrayList<>(conditions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConditionedStatus that = (ConditionedStatus) o;
        return Objects.equals(observedGeneration, that.observedGeneration)
                && Objects.equals(lastHandledReconcileAt, that.lastHandledReconcileAt)
                && Objects.equals(conditions, that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observedGeneration, lastHandledReconcileAt, conditions);
    }

    @Override
    public String toString() {
        return "ConditionedStatus{" +
                "observedGeneration=" + observedGeneration +
                ", lastHandledReconcileAt='" + lastHandledReconcileAt + '\'' +
                ", conditions=" + conditions +
                '}';
    }
}
