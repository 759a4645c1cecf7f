/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Condition;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The narrow view of a resource that the engine reads and mutates.
 * Implementations are not expected to be thread safe: a single reconcile owns the instance
 * for the duration of a call.
 */
public interface ObjectWithConditions {

    /**
     * @return the status conditions, never null.
     */
    List<Condition> getConditions();

    void setConditions(List<Condition> conditions);

    /**
     * @return {@code metadata.generation}, or null if the resource has not been persisted.
     */
    @Nullable
    Long getGeneration();

    @Nullable
    Long getStatusObservedGeneration();

    void setStatusObservedGeneration(@Nullable Long observedGeneration);

    /**
     * @return the value of a pending out-of-band reconcile request, if any.
     */
    Optional<String> getReconcileRequest();

    @Nullable
    String getLastHandledReconcileAt();

    void setLastHandledReconcileAt(@Nullable String lastHandledReconcileAt);
}
