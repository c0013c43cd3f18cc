package com.guardian.rag.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link VectorIndex} with exact (brute force) scoring. Useful
 * for tests and single-process demos; contents die with the JVM.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private record Collection(int dimension, Distance distance, Map<String, IndexedPoint> points) {}

    private final Map<String, Collection> collections = new ConcurrentHashMap<>();

    @Override
    public boolean ensureCollection(String collection, int dimension, Distance distance) {
        boolean[] created = {false};
        collections.computeIfAbsent(collection, name -> {
            created[0] = true;
            return new Collection(dimension, distance, new LinkedHashMap<>());
        });
        return created[0];
    }

    @Override
    public OptionalInt dimension(String collection) {
        Collection c = collections.get(collection);
        return c == null ? OptionalInt.empty() : OptionalInt.of(c.dimension());
    }

    @Override
    public void upsert(String collection, List<IndexedPoint> points) {
        Collection c = require(collection);
        for (IndexedPoint p : points) {
            if (p.vector() == null || p.vector().size() != c.dimension()) {
                throw new IndexException("Vector dimension mismatch for id=" + p.id()
                        + " expected=" + c.dimension()
                        + " got=" + (p.vector() == null ? "null" : p.vector().size()));
            }
        }
        synchronized (c) {
            for (IndexedPoint p : points) {
                c.points().put(p.id(), new IndexedPoint(p.id(), List.copyOf(p.vector()), Collections.unmodifiableMap(new LinkedHashMap<>(p.payload()))));
            }
        }
    }

    @Override
    public List<ScoredCandidate> search(String collection, List<Double> vector, int limit) {
        Collection c = collections.get(collection);
        if (c == null) return List.of();
        if (vector.size() != c.dimension()) {
            throw new IndexException("Query dimension " + vector.size() + " does not match collection dimension " + c.dimension());
        }

        List<ScoredCandidate> scored = new ArrayList<>();
        synchronized (c) {
            for (IndexedPoint p : c.points().values()) {
                scored.add(new ScoredCandidate(p.id(), ChunkPayload.fromMap(p.payload()), score(c.distance(), vector, p.vector())));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    @Override
    public long count(String collection) {
        Collection c = collections.get(collection);
        if (c == null) return 0;
        synchronized (c) {
            return c.points().size();
        }
    }

    @Override
    public void deleteByDocId(String collection, String docId) {
        Collection c = collections.get(collection);
        if (c == null) return;
        synchronized (c) {
            c.points().values().removeIf(p -> Objects.equals(docId, p.payload().get(ChunkPayload.DOC_ID)));
        }
    }

    private Collection require(String collection) {
        Collection c = collections.get(collection);
        if (c == null) {
            throw new IndexException("Collection '" + collection + "' does not exist");
        }
        return c;
    }

    // Higher is always better, so euclidean distance is negated
    static double score(Distance distance, List<Double> a, List<Double> b) {
        double dot = 0, normA = 0, normB = 0, sq = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
            sq += (x - y) * (x - y);
        }
        return switch (distance) {
            case DOT -> dot;
            case EUCLID -> -Math.sqrt(sq);
            case COSINE -> (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
        };
    }
}
