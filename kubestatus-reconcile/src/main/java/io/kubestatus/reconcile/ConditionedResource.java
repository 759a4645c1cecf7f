/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Adapts a Kubernetes resource whose status extends {@link ConditionedStatus} to {@link ObjectWithConditions}.
 * A custom resource typically only needs to declare the interface and implement {@link #newStatus()}:
 * <pre>{@code
 * public class Widget extends CustomResource<WidgetSpec, WidgetStatus> implements ConditionedResource<WidgetStatus> {
 *     public WidgetStatus newStatus() {
 *         return new WidgetStatus();
 *     }
 * }
 * }</pre>
 * @param <S> the status type
 */
public interface ConditionedResource<S extends ConditionedStatus> extends HasMetadata, ObjectWithConditions {

    @Nullable
    S getStatus();

    void setStatus(S status);

    /**
     * @return an empty status, installed the first time the engine writes to a resource without one.
     */
    S newStatus();

    private S statusForUpdate() {
        S status = getStatus();
        if (status == null) {
            status = newStatus();
            setStatus(status);
        }
        return status;
    }

    @Override
    @JsonIgnore
    default List<Condition> getConditions() {
        return Optional.ofNullable(getStatus()).map(ConditionedStatus::getConditions).orElse(List.of());
    }

    @Override
    default void setConditions(List<Condition> conditions) {
        statusForUpdate().setConditions(conditions);
    }

    @Override
    @JsonIgnore
    default @Nullable Long getGeneration() {
        return Optional.ofNullable(getMetadata()).map(ObjectMeta::getGeneration).orElse(null);
    }

    @Override
    @JsonIgnore
    default @Nullable Long getStatusObservedGeneration() {
        return Optional.ofNullable(getStatus()).map(ConditionedStatus::getObservedGeneration).orElse(null);
    }

    @Override
    default void setStatusObservedGeneration(@Nullable Long observedGeneration) {
        statusForUpdate().setObservedGeneration(observedGeneration);
    }

    @Override
    @JsonIgnore
    default Optional<String> getReconcileRequest() {
        return Annotations.reconcileRequest(this);
    }

    @Override
    @JsonIgnore
    default @Nullable String getLastHandledReconcileAt() {
        return Optional.ofNullable(getStatus()).map(ConditionedStatus::getLastHandledReconcileAt).orElse(null);
    }

    @Override
    default void setLastHandledReconcileAt(@Nullable String lastHandledReconcileAt) {
        statusForUpdate().setLastHandledReconcileAt(lastHandledReconcileAt);
    }
}
