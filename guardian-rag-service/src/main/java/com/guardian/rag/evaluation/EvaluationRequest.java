package com.guardian.rag.evaluation;

/**
 * @param topK    candidates pulled from the index
 * @param maxCtx  snippets handed to the model, taken from the top of the candidates
 * @param rerank  apply the reranker between retrieval and truncation
 */
public record EvaluationRequest(String collection, String text, int topK, int maxCtx, boolean rerank) {

    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_MAX_CTX = 5;

    public EvaluationRequest {
        if (topK < 1) throw new IllegalArgumentException("topK must be >= 1, got " + topK);
        if (maxCtx < 0) throw new IllegalArgumentException("maxCtx must be >= 0, got " + maxCtx);
    }

    public static EvaluationRequest of(String collection, String text) {
        return new EvaluationRequest(collection, text, DEFAULT_TOP_K, DEFAULT_MAX_CTX, false);
    }
}
