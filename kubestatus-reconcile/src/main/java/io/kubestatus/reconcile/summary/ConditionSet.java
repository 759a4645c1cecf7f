/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.summary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static configuration of one summary: which condition types are consulted, in priority order,
 * to compute a target condition, and which of them are abnormal when {@code True}.
 * <br>
 * Instances are immutable and may be shared between reconcilers.
 */
public final class ConditionSet {

    private final String target;
    private final List<String> owned;
    private final List<String> summarize;
    private final List<String> negativePolarity;
    private final Map<String, Polarity> polarities;

    private ConditionSet(String target, List<String> owned, List<String> summarize, List<String> negativePolarity) {
        Objects.requireNonNull(target, "target cannot be null");
        if (target.isEmpty()) {
            throw new IllegalArgumentException("target cannot be empty");
        }
        this.target = target;
        this.owned = List.copyOf(new LinkedHashSet<>(owned));
        this.summarize = List.copyOf(new LinkedHashSet<>(summarize));
        this.negativePolarity = List.copyOf(new LinkedHashSet<>(negativePolarity));
        if (this.summarize.contains(target)) {
            throw new IllegalArgumentException("target " + target + " cannot be summarized into itself");
        }
        var unknown = new ArrayList<>(this.negativePolarity);
        unknown.removeAll(this.summarize);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("negative polarity types " + unknown + " are not summarized into " + target);
        }
        Map<String, Polarity> lookup = new HashMap<>();
        for (String type : this.summarize) {
            lookup.put(type, this.negativePolarity.contains(type) ? Polarity.NEGATIVE : Polarity.POSITIVE);
        }
        this.polarities = Map.copyOf(lookup);
    }

    public static ConditionSet of(String target,
                                  List<String> owned,
                                  List<String> summarize,
                                  List<String> negativePolarity) {
        return new ConditionSet(target, owned, summarize, negativePolarity);
    }

    public static Builder builder(String target) {
        return new Builder(target);
    }

    public String target() {
        return target;
    }

    public List<String> owned() {
        return owned;
    }

    public List<String> summarize() {
        return summarize;
    }

    public List<String> negativePolarity() {
        return negativePolarity;
    }

    /**
     * @param type a type listed in {@link #summarize()}
     * @return the polarity of the type
     * @throws IllegalArgumentException if the type is not summarized by this set
     */
    public Polarity polarity(String type) {
        Polarity polarity = polarities.get(type);
        if (polarity == null) {
            throw new IllegalArgumentException(type + " is not summarized into " + target);
        }
        return polarity;
    }

    /**
     * Whether the summarizer may consult the given type. An empty owned list places no restriction.
     */
    boolean mayConsult(String type) {
        return owned.isEmpty() || owned.contains(type);
    }

    /**
     * @param conditionSets some condition sets
     * @return the union of their owned types, in first-seen order
     */
    public static List<String> allOwned(Collection<ConditionSet> conditionSets) {
        Set<String> all = new LinkedHashSet<>();
        conditionSets.forEach(set -> all.addAll(set.owned()));
        return List.copyOf(all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConditionSet that)) {
            return false;
        }
        return target.equals(that.target)
                && owned.equals(that.owned)
                && summarize.equals(that.summarize)
                && negativePolarity.equals(that.negativePolarity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, owned, summarize, negativePolarity);
    }

    @Override
    public String toString() {
        return "ConditionSet{" +
                "target='" + target + '\'' +
                ", owned=" + owned +
                ", summarize=" + summarize +
                ", negativePolarity=" + negativePolarity +
                '}';
    }

    public static final class Builder {
        private final String target;
        private final List<String> owned = new ArrayList<>();
        private final List<String> summarize = new ArrayList<>();
        private final List<String> negativePolarity = new ArrayList<>();

        private Builder(String target) {
            this.target = target;
        }

        public Builder owned(String... types) {
            owned.addAll(List.of(types));
            return this;
        }

        /**
         * Appends positive polarity types, at a lower priority than those already added.
         */
        public Builder summarize(String... types) {
            summarize.addAll(List.of(types));
            return this;
        }

        /**
         * Appends negative polarity types, at a lower priority than those already added.
         */
        public Builder summarizeNegative(String... types) {
            summarize.addAll(List.of(types));
            negativePolarity.addAll(List.of(types));
            return this;
        }

        public ConditionSet build() {
            return new ConditionSet(target, owned, summarize, negativePolarity);
        }
    }
}
