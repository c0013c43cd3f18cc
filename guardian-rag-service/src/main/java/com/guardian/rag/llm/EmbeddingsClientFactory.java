package com.guardian.rag.llm;

/**
 * Builds an embeddings client for a model name, so a command can override
 * the configured model for one run.
 */
@FunctionalInterface
public interface EmbeddingsClientFactory {

    EmbeddingsClient create(String model);
}
