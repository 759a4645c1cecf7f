/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.patch;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;

import io.kubestatus.reconcile.ObjectWithConditions;

/**
 * Persists a status through the {@code status} subresource using server-side apply.
 * The latest copy is read first so that conditions this writer does not own are preserved.
 *
 * @param <R> the resource type
 */
public class KubernetesStatusPatcher<R extends HasMetadata & ObjectWithConditions> implements StatusPatcher<R> {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesStatusPatcher.class);

    static final String DEFAULT_FIELD_MANAGER = "kubestatus";
    private static final String STATUS_SUBRESOURCE = "status";

    private final KubernetesClient client;

    public KubernetesStatusPatcher(KubernetesClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
    }

    @Override
    public R patchStatus(R resource, List<PatchOption> options) {
        PatchHelperOptions helperOptions = PatchHelperOptions.of(options);
        R latest = client.resource(resource).get();
        if (latest == null) {
            throw new KubernetesClientException("Cannot patch the status of " + describe(resource) + " because it no longer exists");
        }
        StatusPatches.applyTo(latest, resource, helperOptions);
        // server-side apply refuses a body carrying managed fields
        latest.getMetadata().setManagedFields(null);

        String fieldManager = helperOptions.fieldOwner().isEmpty() ? DEFAULT_FIELD_MANAGER : helperOptions.fieldOwner();
        PatchContext patchContext = new PatchContext.Builder()
                .withPatchType(PatchType.SERVER_SIDE_APPLY)
                .withFieldManager(fieldManager)
                .withForce(true)
                .build();
        LOGGER.atDebug().setMessage("Patching status of {} as {}, owning {}")
                .addArgument(() -> describe(resource))
                .addArgument(fieldManager)
                .addArgument(helperOptions::ownedConditions)
                .log();
        return client.resource(latest).subresource(STATUS_SUBRESOURCE).patch(patchContext);
    }

    private static String describe(HasMetadata resource) {
        return resource.getKind() + " " + resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName();
    }
}
