package com.guardian.rag.evaluation.backend;

import com.guardian.rag.evaluation.EvaluationFailure;
import com.guardian.rag.evaluation.EvaluationOutcome;
import com.guardian.rag.evaluation.EvaluationRequest;
import com.guardian.rag.evaluation.SafetyPipeline;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InProcessEvaluationBackend implements EvaluationBackend {

    private final SafetyPipeline pipeline;

    public InProcessEvaluationBackend(SafetyPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public EvaluationOutcome evaluate(EvaluationRequest request) {
        try {
            return pipeline.evaluate(request);
        } catch (RuntimeException e) {
            // The pipeline reports its own failures; this only catches bugs
            log.error("Safety pipeline threw unexpectedly", e);
            return EvaluationOutcome.failure(EvaluationFailure.Kind.UPSTREAM, String.valueOf(e.getMessage()));
        }
    }

    @Override
    public String name() {
        return "in-process";
    }
}
