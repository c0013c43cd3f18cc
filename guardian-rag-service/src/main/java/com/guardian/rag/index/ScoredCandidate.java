package com.guardian.rag.index;

/**
 * A search hit: payload plus the score that ranked it. Never persisted.
 */
public record ScoredCandidate(String id, ChunkPayload payload, double score) {

    public String text() {
        return payload.text();
    }

    public ScoredCandidate withScore(double newScore) {
        return new ScoredCandidate(id, payload, newScore);
    }
}
