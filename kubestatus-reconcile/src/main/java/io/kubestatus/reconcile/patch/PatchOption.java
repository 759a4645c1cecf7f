/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.List;
import java.util.Objects;

/**
 * Metadata for the persistence layer, describing how a status snapshot should be written.
 */
public sealed interface PatchOption permits PatchOption.FieldOwner, PatchOption.OwnedConditions, PatchOption.IncludeStatusObservedGeneration {

    void applyTo(PatchHelperOptions.Builder options);

    /**
     * The field manager name used for server-side apply. May be empty.
     */
    record FieldOwner(String name) implements PatchOption {
        public FieldOwner {
            Objects.requireNonNull(name);
        }

        @Override
        public void applyTo(PatchHelperOptions.Builder options) {
            options.fieldOwner(name);
        }
    }

    /**
     * The condition types the writer owns, and which therefore win over the persisted values. May be empty.
     */
    record OwnedConditions(List<String> types) implements PatchOption {
        public OwnedConditions {
            types = List.copyOf(types);
        }

        @Override
        public void applyTo(PatchHelperOptions.Builder options) {
            options.ownedConditions(types);
        }
    }

    /**
     * Publish {@code metadata.generation} as {@code status.observedGeneration}.
     */
    record IncludeStatusObservedGeneration() implements PatchOption {
        @Override
        public void applyTo(PatchHelperOptions.Builder options) {
            options.includeStatusObservedGeneration(true);
        }
    }
}
