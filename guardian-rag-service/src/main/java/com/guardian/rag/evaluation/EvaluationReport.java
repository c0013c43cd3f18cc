package com.guardian.rag.evaluation;

import java.util.List;

/**
 * A completed evaluation together with the policy snippets it was based on.
 * {@code degraded} means no snippets were found, so the verdict has no policy
 * grounding and deserves less trust.
 */
public record EvaluationReport(SafetyEvaluation evaluation, List<String> contexts, boolean degraded) {

    /** Printed by the CLI ahead of the JSON block when no context was found. */
    public static final String DEGRADED_WARNING =
            "Warning: No relevant context found in the database. Evaluation may be unreliable.";

    public EvaluationReport {
        contexts = List.copyOf(contexts);
    }
}
