/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.ArrayList;
import java.util.List;

import io.kubestatus.reconcile.Conditions;
import io.kubestatus.reconcile.ObjectWithConditions;

/**
 * Composes the options used to persist the status computed by a reconcile.
 */
public final class PatchOptions {

    private PatchOptions() {
    }

    /**
     * Appends the field owner and owned conditions to the base options. The observed generation is only
     * published when the status is terminal, that is when {@code Stalled=True} or {@code Ready=True}:
     * an in-progress status does not yet describe the current generation.
     *
     * @param resource the reconciled resource, with its final conditions
     * @param baseOptions options supplied by the caller, not modified
     * @param ownedConditionTypes the condition types owned by the caller
     * @param fieldOwner the field manager name
     * @return the options
     */
    public static List<PatchOption> compose(ObjectWithConditions resource,
                                            List<PatchOption> baseOptions,
                                            List<String> ownedConditionTypes,
                                            String fieldOwner) {
        List<PatchOption> options = new ArrayList<>(baseOptions);
        options.add(new PatchOption.FieldOwner(fieldOwner));
        options.add(new PatchOption.OwnedConditions(ownedConditionTypes));
        if (Conditions.isStalled(resource) || Conditions.isReady(resource)) {
            options.add(new PatchOption.IncludeStatusObservedGeneration());
        }
        return options;
    }
}
