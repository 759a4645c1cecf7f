/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaFluent;

/**
 * Reads and writes the annotations the engine cares about, so the annotation keys
 * are known in a single place.
 */
public class Annotations {

    /**
     * Set (typically to a timestamp) by a user or tool asking for an out-of-band reconcile.
     * Its value is acknowledged by copying it to {@code status.lastHandledReconcileAt}.
     */
    public static final String RECONCILE_REQUEST_ANNOTATION_KEY = "reconcile.kubestatus.io/requestedAt";

    private Annotations() {
    }

    /**
     * @param hasMetadata the resource
     * @return the non-empty value of the reconcile request annotation, if present
     */
    public static Optional<String> reconcileRequest(HasMetadata hasMetadata) {
        return Optional.ofNullable(hasMetadata.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .map(annotations -> annotations.get(RECONCILE_REQUEST_ANNOTATION_KEY))
                .filter(value -> !value.isEmpty());
    }

    /**
     * Adds a {@value #RECONCILE_REQUEST_ANNOTATION_KEY} annotation to the supplied metadata fluent
     * @param meta the metadata fluent builder
     * @param requestedAt the request value
     */
    public static void annotateWithReconcileRequest(ObjectMetaFluent<?> meta, String requestedAt) {
        Objects.requireNonNull(meta);
        Objects.requireNonNull(requestedAt);
        meta.addToAnnotations(RECONCILE_REQUEST_ANNOTATION_KEY, requestedAt);
    }

    /**
     * Mutates a HasMetadata, adding a {@value #RECONCILE_REQUEST_ANNOTATION_KEY} annotation.
     * Metadata and annotations are created if they are null.
     * @param hasMetadata the resource
     * @param requestedAt the request value
     */
    public static void annotateWithReconcileRequest(HasMetadata hasMetadata, String requestedAt) {
        Objects.requireNonNull(hasMetadata);
        Objects.requireNonNull(requestedAt);
        if (hasMetadata.getMetadata() == null) {
            hasMetadata.setMetadata(new ObjectMeta());
        }
        ObjectMeta metadata = hasMetadata.getMetadata();
        if (metadata.getAnnotations() == null) {
            metadata.setAnnotations(new HashMap<>());
        }
        Map<String, String> annotations = metadata.getAnnotations();
        annotations.put(RECONCILE_REQUEST_ANNOTATION_KEY, requestedAt);
    }
}
