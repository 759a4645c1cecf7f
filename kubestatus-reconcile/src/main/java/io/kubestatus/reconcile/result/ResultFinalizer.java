/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.result;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Condition;

import io.kubestatus.reconcile.ConditionMarker;
import io.kubestatus.reconcile.ConditionStatus;
import io.kubestatus.reconcile.Conditions;
import io.kubestatus.reconcile.ObjectWithConditions;
import io.kubestatus.reconcile.Reasons;
import io.kubestatus.reconcile.summary.ConditionSet;
import io.kubestatus.reconcile.summary.ConditionSummarizer;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.kubestatus.reconcile.ConditionTypes.READY;
import static io.kubestatus.reconcile.ConditionTypes.RECONCILING;
import static io.kubestatus.reconcile.ConditionTypes.STALLED;

/**
 * <p>Computes the {@code Ready}, {@code Stalled} and {@code Reconciling} conditions at the end of a reconcile
 * from the result and error the reconciler is about to return, after summarizing the configured
 * {@link ConditionSet}s.</p>
 *
 * <p>Business logic usually knows more about a failure than the finalizer does, so a {@code Ready}
 * condition already set by the reconciler is kept wherever it is consistent with the outcome:
 * the finalizer fills gaps and flags contradictions.</p>
 *
 * <p>Instances are immutable and can be shared by concurrent reconciles of different resources.</p>
 */
public class ResultFinalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultFinalizer.class);

    private final SuccessPredicate successPredicate;
    private final SuccessType successType;
    private final String readySuccessMessage;
    private final List<ConditionSet> conditionSets;
    private final ConditionMarker marker;
    private final ConditionSummarizer summarizer;

    public ResultFinalizer(Clock clock,
                           SuccessPredicate successPredicate,
                           String readySuccessMessage,
                           ConditionSet... conditionSets) {
        this(clock, successPredicate, readySuccessMessage, List.of(conditionSets));
    }

    public ResultFinalizer(Clock clock,
                           SuccessPredicate successPredicate,
                           String readySuccessMessage,
                           List<ConditionSet> conditionSets) {
        this.successPredicate = Objects.requireNonNull(successPredicate, "successPredicate cannot be null");
        this.readySuccessMessage = Objects.requireNonNull(readySuccessMessage, "readySuccessMessage cannot be null");
        this.conditionSets = List.copyOf(conditionSets);
        this.marker = new ConditionMarker(clock);
        this.summarizer = new ConditionSummarizer(marker);
        this.successType = SuccessType.determine(successPredicate);
        LOGGER.debug("Finalizing results of a {} reconciler, summarizing {}", successType, this.conditionSets);
    }

    public SuccessType successType() {
        return successType;
    }

    public List<ConditionSet> conditionSets() {
        return conditionSets;
    }

    /**
     * Updates the status conditions of the resource to reflect the outcome of the reconcile.
     * A pending reconcile request is acknowledged whatever the outcome. A non-null {@code error}
     * always takes the error path, even if the success predicate would accept the result.
     *
     * @param resource the reconciled resource
     * @param result the result the reconciler is about to return
     * @param error the error the reconciler is about to throw, if any
     * @throws FinalizationException if the result is a success but {@code Ready} is {@code False}
     * @throws Exception {@code error}, unchanged, once the conditions reflect it
     */
    public void finalizeStatus(ObjectWithConditions resource,
                               ReconcileResult result,
                               @Nullable Exception error)
            throws Exception {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(result, "result cannot be null");

        // an error is never a success, whatever the predicate says
        boolean success = error == null && successPredicate.isSuccess(result, null);
        if (success && successType == SuccessType.NO_REQUEUE_ON_SUCCESS && Conditions.isStalled(resource)) {
            // an empty result is also what a stalled no-requeue reconciler returns
            success = false;
        }

        // Stalled and Reconciling are resolved before summarizing so they can't drive the summary.
        if (success) {
            Conditions.delete(resource, STALLED);
            Conditions.delete(resource, RECONCILING);
        }
        else if (error == null) {
            if (result.requeueRequested()) {
                Conditions.delete(resource, STALLED);
            }
            else if (Conditions.isStalled(resource)) {
                Conditions.delete(resource, RECONCILING);
            }
        }

        summarizer.summarizeAll(resource, conditionSets);
        acknowledgeReconcileRequest(resource);

        if (success) {
            finalizeSuccess(resource);
        }
        else if (error != null) {
            finalizeError(resource, error);
            throw error;
        }
        else if (Conditions.isStalled(resource)) {
            finalizeStalled(resource);
        }
    }

    private void finalizeSuccess(ObjectWithConditions resource) {
        Optional<ConditionStatus> ready = Conditions.status(resource, READY);
        if (ready.isEmpty() || ready.get() == ConditionStatus.UNKNOWN) {
            marker.markTrue(resource, READY, Reasons.SUCCEEDED, readySuccessMessage);
        }
        else if (ready.get() == ConditionStatus.FALSE) {
            if (successType == SuccessType.REQUEUE_ON_SUCCESS) {
                String message = Conditions.get(resource, READY).map(Condition::getMessage).orElse("");
                throw new FinalizationException("reconcile reported success but " + READY + " is False: " + message);
            }
            LOGGER.debug("Retaining {}=False after an empty result", READY);
        }
    }

    private void finalizeError(ObjectWithConditions resource, Exception error) {
        if (Conditions.isFalse(resource, READY)) {
            LOGGER.atDebug().setMessage("Retaining existing {}=False after error {}")
                    .addArgument(READY)
                    .addArgument(error::toString)
                    .log();
            return;
        }
        marker.markFalse(resource, READY, Reasons.FAILED, String.valueOf(error.getMessage()));
    }

    private void finalizeStalled(ObjectWithConditions resource) {
        if (Conditions.isFalse(resource, READY)) {
            return;
        }
        Conditions.get(resource, STALLED).ifPresent(stalled -> marker.markFrom(resource, READY, ConditionStatus.FALSE, stalled));
    }

    private static void acknowledgeReconcileRequest(ObjectWithConditions resource) {
        resource.getReconcileRequest().ifPresent(requestedAt -> {
            if (!requestedAt.equals(resource.getLastHandledReconcileAt())) {
                LOGGER.debug("Acknowledging reconcile request {}", requestedAt);
                resource.setLastHandledReconcileAt(requestedAt);
            }
        });
    }
}
