package com.guardian.rag.evaluation;

import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.metrics.GuardianMetrics;
import com.guardian.rag.rerank.RerankerService;
import com.guardian.rag.retrieval.Retriever;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Retrieve, optionally rerank, then evaluate. The single exit for failures is
 * a failed {@link EvaluationOutcome}; nothing is thrown and nothing is retried.
 */
@Slf4j
public class SafetyPipeline {

    private final Retriever retriever;
    private final RerankerService reranker;
    private final SafetyEvaluator evaluator;
    private final GuardianMetrics metrics;

    public SafetyPipeline(Retriever retriever, RerankerService reranker, SafetyEvaluator evaluator,
                          GuardianMetrics metrics) {
        this.retriever = retriever;
        this.reranker = reranker;
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    public EvaluationOutcome evaluate(EvaluationRequest request) {
        long start = System.currentTimeMillis();

        List<String> contexts;
        try {
            List<ScoredCandidate> hits = retriever.search(request.collection(), request.text(), request.topK());
            if (request.rerank()) {
                hits = reranker.rerank(request.text(), hits);
            }
            contexts = hits.stream()
                    .limit(request.maxCtx())
                    .map(ScoredCandidate::text)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Policy retrieval from '{}' failed: {}", request.collection(), e.getMessage());
            return EvaluationOutcome.failure(EvaluationFailure.Kind.RETRIEVAL, e.getMessage());
        }

        if (contexts.isEmpty()) {
            log.warn("No policy context found in '{}'; verdict will be ungrounded", request.collection());
            metrics.recordDegraded();
        }

        EvaluationOutcome outcome = evaluator.evaluate(request.text(), contexts);
        metrics.recordEvaluationTime(System.currentTimeMillis() - start);
        return outcome;
    }
}
