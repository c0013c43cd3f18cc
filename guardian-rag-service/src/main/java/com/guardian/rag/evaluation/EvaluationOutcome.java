package com.guardian.rag.evaluation;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an evaluation attempt: either a report or the reason there is none.
 * Evaluators return this instead of throwing; deciding what a failure means
 * for the end user is left to the caller.
 */
public final class EvaluationOutcome {

    private final EvaluationReport report;
    private final EvaluationFailure failure;

    private EvaluationOutcome(EvaluationReport report, EvaluationFailure failure) {
        this.report = report;
        this.failure = failure;
    }

    public static EvaluationOutcome success(EvaluationReport report) {
        return new EvaluationOutcome(Objects.requireNonNull(report), null);
    }

    public static EvaluationOutcome failure(EvaluationFailure.Kind kind, String message) {
        return new EvaluationOutcome(null, new EvaluationFailure(kind, message));
    }

    public boolean isSuccess() {
        return report != null;
    }

    public EvaluationReport report() {
        if (report == null) {
            throw new IllegalStateException("Evaluation failed: " + failure);
        }
        return report;
    }

    public EvaluationFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Evaluation succeeded");
        }
        return failure;
    }

    public <T> T fold(Function<EvaluationReport, T> onSuccess, Function<EvaluationFailure, T> onFailure) {
        return report != null ? onSuccess.apply(report) : onFailure.apply(failure);
    }

    @Override
    public String toString() {
        return report != null ? "EvaluationOutcome[success=" + report + "]" : "EvaluationOutcome[failure=" + failure + "]";
    }
}
