package com.guardian.rag.service;

import com.guardian.rag.evaluation.EvaluationFailure;
import com.guardian.rag.evaluation.EvaluationReport;
import com.guardian.rag.evaluation.EvaluationRequest;
import com.guardian.rag.evaluation.SafetyEvaluation;
import com.guardian.rag.evaluation.backend.EvaluationBackend;
import com.guardian.rag.metrics.GuardianMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point for safety checks. Applies the fail-closed policy: any failed
 * evaluation becomes the "not safe" system-error verdict.
 */
@Slf4j
@Service
public class GuardianService {

    private final EvaluationBackend backend;
    private final GuardianMetrics metrics;
    private final String collection;
    private final int topK;
    private final int maxCtx;
    private final boolean rerank;

    public GuardianService(
            EvaluationBackend backend,
            GuardianMetrics metrics,
            @Value("${guardian.collection:guardianai_policies}") String collection,
            @Value("${guardian.evaluation.top-k:5}") int topK,
            @Value("${guardian.evaluation.max-ctx:5}") int maxCtx,
            @Value("${guardian.evaluation.rerank:false}") boolean rerank
    ) {
        this.backend = backend;
        this.metrics = metrics;
        this.collection = collection;
        this.topK = topK;
        this.maxCtx = maxCtx;
        this.rerank = rerank;

        log.info("[GUARDIAN] Evaluation backend={}, collection={}, topK={}, maxCtx={}, rerank={}",
                backend.name(), collection, topK, maxCtx, rerank);
    }

    /**
     * Evaluates against the configured policy collection with default settings.
     */
    public GuardianVerdict evaluate(String text) {
        return evaluate(new EvaluationRequest(collection, text, topK, maxCtx, rerank));
    }

    public GuardianVerdict evaluate(EvaluationRequest request) {
        String text = request.text();
        log.info("[GUARDIAN] Evaluating {} chars against '{}'", text == null ? 0 : text.length(), request.collection());
        GuardianVerdict verdict;
        try {
            verdict = backend.evaluate(request).fold(this::accept, this::failClosed);
        } catch (RuntimeException e) {
            verdict = failClosed(new EvaluationFailure(EvaluationFailure.Kind.BACKEND_PROCESS,
                    "Backend " + backend.name() + " threw " + e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        metrics.recordVerdict(verdict.evaluation().safetyLevel().value());
        return verdict;
    }

    private GuardianVerdict accept(EvaluationReport report) {
        if (report.degraded()) {
            log.warn("[GUARDIAN] Verdict '{}' has no policy grounding", report.evaluation().safetyLevel().value());
        }
        return new GuardianVerdict(report.evaluation(), report.degraded(), null);
    }

    private GuardianVerdict failClosed(EvaluationFailure failure) {
        log.error("[GUARDIAN] Evaluation failed ({}): {}. Returning fail-safe verdict.", failure.kind(), failure.message());
        metrics.recordFailSafe(failure.kind().name());
        return new GuardianVerdict(SafetyEvaluation.failSafe(), false, failure);
    }

    public String getCollection() {
        return collection;
    }
}
