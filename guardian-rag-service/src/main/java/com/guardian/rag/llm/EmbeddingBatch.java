package com.guardian.rag.llm;

import java.util.List;

public record EmbeddingBatch(List<List<Double>> vectors, int dimension) {

    public List<Double> first() {
        return vectors.get(0);
    }

    public int size() {
        return vectors.size();
    }
}
