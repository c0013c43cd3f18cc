package com.guardian.rag.retrieval;

import com.guardian.rag.index.ScoredCandidate;
import com.guardian.rag.index.VectorIndex;
import com.guardian.rag.llm.EmbeddingsClient;
import com.guardian.rag.metrics.GuardianMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Embeds a query and returns the closest chunks of a collection, best first.
 */
public class Retriever {

    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    private final EmbeddingsClient embeddings;
    private final VectorIndex index;
    private final GuardianMetrics metrics;

    public Retriever(EmbeddingsClient embeddings, VectorIndex index, GuardianMetrics metrics) {
        this.embeddings = embeddings;
        this.index = index;
        this.metrics = metrics;
    }

    /**
     * @param topK maximum number of hits, at least 1
     * @return at most {@code topK} candidates in descending similarity
     */
    public List<ScoredCandidate> search(String collection, String query, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, got " + topK);
        }

        long start = System.currentTimeMillis();
        List<Double> queryVector = embeddings.embed(List.of(query)).first();
        List<ScoredCandidate> hits = index.search(collection, queryVector, topK);
        long elapsed = System.currentTimeMillis() - start;

        metrics.recordRetrieval(elapsed);
        log.info("[TIMING] Retrieval from '{}' (topK={}): {}ms, found {} results", collection, topK, elapsed, hits.size());
        return hits;
    }
}
