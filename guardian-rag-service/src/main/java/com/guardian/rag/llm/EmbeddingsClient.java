package com.guardian.rag.llm;

import java.util.List;

public interface EmbeddingsClient {

    /**
     * Embeds a non-empty batch. Vectors come back in input order.
     *
     * @throws EmbeddingException on an empty batch or any upstream failure
     */
    EmbeddingBatch embed(List<String> texts);

    String model();
}
