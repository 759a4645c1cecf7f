/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.List;

import io.fabric8.kubernetes.api.model.Condition;

import io.kubestatus.reconcile.ConditionSnapshot;
import io.kubestatus.reconcile.ObjectWithConditions;

/**
 * Builds the status to persist by combining the status computed locally with the latest persisted one.
 */
public final class StatusPatches {

    private StatusPatches() {
    }

    /**
     * Writes the local status onto {@code latest}.
     * <ul>
     *     <li>Conditions of owned types are taken from {@code local}, and removed if {@code local} has none.
     *     Other conditions keep their persisted value. With no owned types, all local conditions are taken.</li>
     *     <li>An unchanged status keeps the persisted {@code lastTransitionTime}.</li>
     *     <li>The status observed generation is stamped only if the options ask for it.</li>
     * </ul>
     *
     * @param latest the latest persisted copy, mutated
     * @param local the reconciled copy
     * @param options the folded patch options
     */
    public static void applyTo(ObjectWithConditions latest, ObjectWithConditions local, PatchHelperOptions options) {
        latest.setConditions(mergeConditions(latest.getConditions(), local.getConditions(), options.ownedConditions()));
        if (local.getLastHandledReconcileAt() != null) {
            latest.setLastHandledReconcileAt(local.getLastHandledReconcileAt());
        }
        if (options.includeStatusObservedGeneration()) {
            latest.setStatusObservedGeneration(local.getGeneration());
        }
    }

    public static List<Condition> mergeConditions(List<Condition> persisted, List<Condition> local, List<String> ownedTypes) {
        ConditionSnapshot persistedSnapshot = ConditionSnapshot.fromList(persisted);
        ConditionSnapshot localSnapshot = ConditionSnapshot.fromList(local);
        if (ownedTypes.isEmpty()) {
            return localSnapshot.over(persistedSnapshot).toList();
        }
        ConditionSnapshot owned = localSnapshot.retaining(ownedTypes).over(persistedSnapshot);
        return owned.union(persistedSnapshot.excluding(ownedTypes)).toList();
    }
}
