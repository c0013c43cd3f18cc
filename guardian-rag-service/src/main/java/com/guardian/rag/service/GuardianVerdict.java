package com.guardian.rag.service;

import com.guardian.rag.evaluation.EvaluationFailure;
import com.guardian.rag.evaluation.SafetyEvaluation;

/**
 * What callers of the guardrail get back.
 *
 * @param degraded true when the verdict was produced without any policy context
 * @param failure  set when the evaluation failed and {@code evaluation} is the fail-safe verdict
 */
public record GuardianVerdict(SafetyEvaluation evaluation, boolean degraded, EvaluationFailure failure) {

    public boolean failedClosed() {
        return failure != null;
    }
}
