package com.guardian.rag.index;

/**
 * Similarity metric of a collection, named the way Qdrant names them.
 */
public enum Distance {
    COSINE("Cosine"),
    DOT("Dot"),
    EUCLID("Euclid");

    private final String qdrantName;

    Distance(String qdrantName) {
        this.qdrantName = qdrantName;
    }

    public String qdrantName() {
        return qdrantName;
    }

    public static Distance fromString(String value) {
        if (value == null || value.isBlank()) return COSINE;
        for (Distance d : values()) {
            if (d.name().equalsIgnoreCase(value) || d.qdrantName.equalsIgnoreCase(value)) return d;
        }
        throw new IllegalArgumentException("Unknown distance metric: " + value);
    }
}
