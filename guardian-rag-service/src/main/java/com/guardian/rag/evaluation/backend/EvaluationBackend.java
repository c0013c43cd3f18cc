package com.guardian.rag.evaluation.backend;

import com.guardian.rag.evaluation.EvaluationOutcome;
import com.guardian.rag.evaluation.EvaluationRequest;

/**
 * Where the safety pipeline runs. Implementations must not throw; every
 * problem is reported as a failed outcome.
 */
public interface EvaluationBackend {

    EvaluationOutcome evaluate(EvaluationRequest request);

    String name();
}
