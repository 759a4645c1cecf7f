/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The effective options after folding a list of {@link PatchOption}s, later options winning.
 *
 * @param fieldOwner the field manager, empty if none was given
 * @param ownedConditions the owned condition types, empty if none were given
 * @param includeStatusObservedGeneration whether to publish the observed generation
 */
public record PatchHelperOptions(String fieldOwner,
                                 List<String> ownedConditions,
                                 boolean includeStatusObservedGeneration) {

    public PatchHelperOptions {
        Objects.requireNonNull(fieldOwner);
        ownedConditions = List.copyOf(ownedConditions);
    }

    public static PatchHelperOptions of(List<PatchOption> options) {
        Builder builder = new Builder();
        options.forEach(option -> option.applyTo(builder));
        return builder.build();
    }

    public static final class Builder {
        private String fieldOwner = "";
        private final List<String> ownedConditions = new ArrayList<>();
        private boolean includeStatusObservedGeneration;

        Builder fieldOwner(String fieldOwner) {
            this.fieldOwner = fieldOwner;
            return this;
        }

        Builder ownedConditions(List<String> types) {
            ownedConditions.clear();
            ownedConditions.addAll(types);
            return this;
        }

        Builder includeStatusObservedGeneration(boolean include) {
            this.includeStatusObservedGeneration = include;
            return this;
        }

        PatchHelperOptions build() {
            return new PatchHelperOptions(fieldOwner, ownedConditions, includeStatusObservedGeneration);
        }
    }
}
