package com.guardian.rag.index;

import com.guardian.rag.ingest.DocumentChunk;
import com.guardian.rag.llm.EmbeddingBatch;
import com.guardian.rag.llm.EmbeddingsClient;
import com.guardian.rag.metrics.GuardianMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes document chunks into a collection.
 *
 * <p>Chunks are embedded and upserted batch by batch. The collection is
 * created only after the first batch is embedded, so it always gets the
 * dimension the embedder actually produces. A failing batch aborts the call;
 * batches written before it stay in the index.
 */
public class IndexManager {

    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);

    private final VectorIndex index;
    private final EmbeddingsClient embeddings;
    private final int batchSize;
    private final Distance distance;
    private final GuardianMetrics metrics;

    public IndexManager(VectorIndex index, EmbeddingsClient embeddings, int batchSize, Distance distance,
                        GuardianMetrics metrics) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        this.index = index;
        this.embeddings = embeddings;
        this.batchSize = batchSize;
        this.distance = distance;
        this.metrics = metrics;
    }

    /**
     * Same index and settings, different embedding model.
     */
    public IndexManager withEmbeddings(EmbeddingsClient other) {
        return new IndexManager(index, other, batchSize, distance, metrics);
    }

    public boolean ensureCollection(String collection, int dimension, Distance distance) {
        return index.ensureCollection(collection, dimension, distance);
    }

    /**
     * @return number of chunks written
     */
    public int upsert(String collection, List<DocumentChunk> chunks, PolicyMetadata metadata) {
        if (chunks.isEmpty()) return 0;

        long start = System.currentTimeMillis();
        PolicyMetadata meta = metadata == null ? PolicyMetadata.empty() : metadata;
        int written = 0;

        for (int i = 0; i < chunks.size(); i += batchSize) {
            List<DocumentChunk> batch = chunks.subList(i, Math.min(chunks.size(), i + batchSize));
            EmbeddingBatch vectors = embeddings.embed(batch.stream().map(DocumentChunk::text).toList());

            if (i == 0) {
                if (index.ensureCollection(collection, vectors.dimension(), distance)) {
                    log.info("Created collection '{}' with dimension {}", collection, vectors.dimension());
                }
            }

            List<IndexedPoint> points = new ArrayList<>(batch.size());
            for (int j = 0; j < batch.size(); j++) {
                DocumentChunk c = batch.get(j);
                ChunkPayload payload = new ChunkPayload(c.text(), c.docId(), c.source(), c.chunkIndex(), meta.asMap());
                points.add(new IndexedPoint(c.id(), vectors.vectors().get(j), payload.toMap()));
            }

            index.upsert(collection, points);
            written += points.size();
            log.debug("Upserted batch {}-{} into '{}'", i, i + points.size() - 1, collection);
        }

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordIngest(written, elapsed);
        log.info("[TIMING] Indexed {} chunks into '{}' in {}ms (model={})", written, collection, elapsed, embeddings.model());
        return written;
    }

    public long count(String collection) {
        return index.count(collection);
    }

    public void deleteByDocId(String collection, String docId) {
        index.deleteByDocId(collection, docId);
        log.info("Deleted points with doc_id={} from '{}'", docId, collection);
    }
}
