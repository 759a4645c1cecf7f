/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Condition;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.kubestatus.reconcile.ConditionTypes.READY;
import static io.kubestatus.reconcile.ConditionTypes.RECONCILING;
import static io.kubestatus.reconcile.ConditionTypes.STALLED;

/**
 * Reads and writes conditions on an {@link ObjectWithConditions}.
 * <br>
 * There <em>should</em> be at most one condition of each type. Readers tolerate duplicates by
 * picking the freshest (see {@link ConditionSnapshot#FRESHEST_CONDITION}), writers collapse them.
 */
public final class Conditions {

    private Conditions() {
    }

    public static Optional<Condition> get(ObjectWithConditions resource, String type) {
        Objects.requireNonNull(type, "type cannot be null");
        return resource.getConditions().stream()
                .filter(condition -> type.equals(condition.getType()))
                .max(ConditionSnapshot.FRESHEST_CONDITION);
    }

    public static boolean has(ObjectWithConditions resource, String type) {
        return get(resource, type).isPresent();
    }

    public static Optional<ConditionStatus> status(ObjectWithConditions resource, String type) {
        return get(resource, type).flatMap(condition -> ConditionStatus.fromValue(condition.getStatus()));
    }

    public static boolean isTrue(ObjectWithConditions resource, String type) {
        return status(resource, type).filter(ConditionStatus.TRUE::equals).isPresent();
    }

    public static boolean isFalse(ObjectWithConditions resource, String type) {
        return status(resource, type).filter(ConditionStatus.FALSE::equals).isPresent();
    }

    public static boolean isUnknown(ObjectWithConditions resource, String type) {
        return status(resource, type).filter(ConditionStatus.UNKNOWN::equals).isPresent();
    }

    public static boolean isReady(ObjectWithConditions resource) {
        return isTrue(resource, READY);
    }

    public static boolean isStalled(ObjectWithConditions resource) {
        return isTrue(resource, STALLED);
    }

    public static boolean isReconciling(ObjectWithConditions resource) {
        return isTrue(resource, RECONCILING);
    }

    /**
     * Replaces any condition of the same type, or appends the condition if there is none.
     * The existing {@code lastTransitionTime} is retained when the status does not change.
     * @param resource the resource to mutate
     * @param condition the new condition
     */
    public static void set(ObjectWithConditions resource, Condition condition) {
        Objects.requireNonNull(condition.getType(), "condition type cannot be null");
        Condition replacement = ConditionSnapshot.retainTransitionTime(get(resource, condition.getType()).orElse(null), condition);

        List<Condition> updated = new ArrayList<>(resource.getConditions().size() + 1);
        boolean placed = false;
        for (Condition current : resource.getConditions()) {
            if (!condition.getType().equals(current.getType())) {
                updated.add(current);
            }
            else if (!placed) {
                updated.add(replacement);
                placed = true;
            }
        }
        if (!placed) {
            updated.add(replacement);
        }
        resource.setConditions(updated);
    }

    public static void delete(ObjectWithConditions resource, String type) {
        if (!has(resource, type)) {
            return;
        }
        resource.setConditions(resource.getConditions().stream()
                .filter(condition -> !type.equals(condition.getType()))
                .toList());
    }

    /**
     * Kubernetes serializes {@code metav1.Time} with second precision.
     * @param instant the time
     * @return the RFC 3339 form
     */
    public static String formatTime(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    static @Nullable Instant parseTime(@Nullable String time) {
        if (time == null || time.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(time);
        }
        catch (DateTimeParseException e) {
            return null;
        }
    }
}
