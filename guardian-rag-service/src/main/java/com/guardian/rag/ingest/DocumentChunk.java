package com.guardian.rag.ingest;

/**
 * One window of a source document, the unit that gets embedded and indexed.
 */
public record DocumentChunk(
        String id,
        String text,
        String docId,
        String source,
        int chunkIndex
) {}
