package com.guardian.rag.evaluation;

public record EvaluationFailure(Kind kind, String message) {

    public enum Kind {
        /** Embedding or vector search failed before the model was asked. */
        RETRIEVAL,
        /** The chat model could not be reached or answered with an error. */
        UPSTREAM,
        /** Response was not a JSON object. */
        MALFORMED_RESPONSE,
        /** JSON object did not match the evaluation schema. */
        SCHEMA_VIOLATION,
        /** Evaluation backend broke down, e.g. the out-of-process evaluator exited abnormally. */
        BACKEND_PROCESS,
        TIMEOUT
    }
}
