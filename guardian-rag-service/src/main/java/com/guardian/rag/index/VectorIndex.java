package com.guardian.rag.index;

import java.util.List;
import java.util.OptionalInt;

/**
 * The vector database as seen by this service. Every operation names its
 * collection; implementations keep no per-collection configuration of their own.
 */
public interface VectorIndex {

    /**
     * Creates the collection unless it already exists.
     *
     * @return {@code true} if a new collection was created
     */
    boolean ensureCollection(String collection, int dimension, Distance distance);

    /**
     * Stored vector dimension, empty when the collection does not exist.
     */
    OptionalInt dimension(String collection);

    /**
     * Overwrites points by id. Every vector must match the collection dimension.
     */
    void upsert(String collection, List<IndexedPoint> points);

    /**
     * Nearest neighbours in descending similarity, payload only. A missing
     * collection yields an empty list.
     */
    List<ScoredCandidate> search(String collection, List<Double> vector, int limit);

    long count(String collection);

    void deleteByDocId(String collection, String docId);
}
