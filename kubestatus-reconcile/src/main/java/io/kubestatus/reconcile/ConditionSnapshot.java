/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import edu.umd.cs.findbugs.annotations.Nullable;

import io.kubestatus.reconcile.tag.VisibleForTesting;

import static java.util.function.Function.identity;

/**
 * An immutable set of conditions, at most one per type, ordered by type.
 * Used to reconcile a locally computed set of conditions with the set last persisted.
 */
public class ConditionSnapshot {

    // we are aiming for a deterministic ordering, so we order by status if observed generation and last transition time are equal
    @VisibleForTesting
    static final Comparator<Condition> FRESHEST_CONDITION = Comparator.comparing(Condition::getObservedGeneration, Comparator.nullsFirst(Long::compareTo))
            .thenComparing(ConditionSnapshot::transitionTime, Comparator.nullsFirst(Instant::compareTo))
            .thenComparing(ConditionSnapshot::status, Comparator.nullsFirst(ConditionStatus::compareTo));

    private final SortedMap<String, Condition> conditions;

    ConditionSnapshot(Map<String, Condition> conditions) {
        Objects.requireNonNull(conditions, "conditions cannot be null");
        this.conditions = new TreeMap<>(conditions);
    }

    public static ConditionSnapshot of(Condition condition) {
        return new ConditionSnapshot(Map.of(condition.getType(), condition));
    }

    /**
     * Builds a snapshot from the list of conditions on a status.
     * Should a type appear more than once, the condition with the largest observed generation wins,
     * then the latest transition time, then Unknown over False over True.
     * @param conditionsList conditions from a status
     * @return the snapshot
     */
    public static ConditionSnapshot fromList(List<Condition> conditionsList) {
        Map<String, Condition> freshestConditionPerType = conditionsList.stream()
                .filter(condition -> condition.getType() != null)
                .collect(Collectors.toMap(Condition::getType, identity(), ConditionSnapshot::freshest));
        return new ConditionSnapshot(freshestConditionPerType);
    }

    private static Condition freshest(Condition c1, Condition c2) {
        return FRESHEST_CONDITION.compare(c1, c2) < 0 ? c2 : c1;
    }

    /**
     * Overlays this snapshot on a persisted one: every condition of this snapshot is taken as is,
     * except that the persisted {@code lastTransitionTime} is kept when the status has not changed.
     * Types only present in {@code persisted} are not included.
     *
     * @param persisted the last persisted conditions
     * @return the conditions to persist
     */
    public ConditionSnapshot over(ConditionSnapshot persisted) {
        Map<String, Condition> result = new TreeMap<>();
        conditions.forEach((type, condition) -> result.put(type, retainTransitionTime(persisted.conditions.get(type), condition)));
        return new ConditionSnapshot(result);
    }

    /**
     * @param types the types to keep
     * @return a snapshot containing only conditions of the given types
     */
    public ConditionSnapshot retaining(Collection<String> types) {
        return filtered(types::contains);
    }

    /**
     * @param types the types to drop
     * @return a snapshot containing no conditions of the given types
     */
    public ConditionSnapshot excluding(Collection<String> types) {
        return filtered(Predicate.not(types::contains));
    }

    private ConditionSnapshot filtered(Predicate<String> typeFilter) {
        return new ConditionSnapshot(conditions.entrySet().stream()
                .filter(entry -> typeFilter.test(entry.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
    }

    /**
     * @param other another snapshot, with no types in common with this one
     * @return a snapshot with the conditions of both
     */
    public ConditionSnapshot union(ConditionSnapshot other) {
        TreeMap<String, Condition> all = new TreeMap<>(other.conditions);
        all.putAll(conditions);
        return new ConditionSnapshot(all);
    }

    public List<String> types() {
        return List.copyOf(conditions.keySet());
    }

    static Condition retainTransitionTime(@Nullable Condition old, Condition condition) {
        if (old != null && Objects.equals(old.getStatus(), condition.getStatus()) && old.getLastTransitionTime() != null) {
            return new ConditionBuilder(condition).withLastTransitionTime(old.getLastTransitionTime()).build();
        }
        return condition;
    }

    public List<Condition> toList() {
        return conditions.values().stream().toList();
    }

    private static @Nullable Instant transitionTime(Condition condition) {
        return Conditions.parseTime(condition.getLastTransitionTime());
    }

    private static @Nullable ConditionStatus status(Condition condition) {
        return ConditionStatus.fromValue(condition.getStatus()).orElse(null);
    }
}
