/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.List;

import io.kubestatus.reconcile.ObjectWithConditions;

/**
 * Persists the status of a reconciled resource.
 * @param <R> the resource type
 */
@FunctionalInterface
public interface StatusPatcher<R extends ObjectWithConditions> {

    /**
     * @param resource the reconciled resource
     * @param options options composed by {@link PatchOptions#compose}
     * @return the resource as persisted
     */
    R patchStatus(R resource, List<PatchOption> options);
}
