package com.guardian.rag.chunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits normalized text into overlapping windows of words.
 *
 * Each window covers {@code [start, start + size)}; the next window starts
 * {@code overlap} words before the previous one ended. The last window always
 * ends on the last word.
 */
public class WordWindowChunker {
    private final int size;
    private final int overlap;

    public WordWindowChunker(int size, int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + size);
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException("Chunk overlap must be in [0, " + size + "), got " + overlap);
        }
        this.size = size;
        this.overlap = overlap;
    }

    public List<String> chunk(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return List.of();

        String[] words = normalized.split(" ");
        List<String> out = new ArrayList<>();
        int start = 0;
        while (start < words.length) {
            int end = Math.min(words.length, start + size);
            out.add(String.join(" ", Arrays.copyOfRange(words, start, end)));
            if (end == words.length) break;
            start = Math.max(0, end - overlap);
        }
        return out;
    }

    public int getSize() {
        return size;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * Collapses every whitespace run to a single space and trims the ends.
     */
    public static String normalize(String s) {
        if (s == null) return "";
        return s.replace("\u0000", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
