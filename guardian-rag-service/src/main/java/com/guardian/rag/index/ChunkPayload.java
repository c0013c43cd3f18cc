package com.guardian.rag.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload stored with every point. The four chunk fields are fixed; anything
 * else came from validated policy metadata.
 */
public record ChunkPayload(
        String text,
        String docId,
        String source,
        int chunkIndex,
        Map<String, Object> metadata
) {
    public static final String TEXT = "text";
    public static final String DOC_ID = "doc_id";
    public static final String SOURCE = "source";
    public static final String CHUNK_INDEX = "chunk_index";

    public Map<String, Object> toMap() {
        Map<String, Object> payload = new LinkedHashMap<>(metadata);
        payload.put(TEXT, text);
        payload.put(DOC_ID, docId);
        payload.put(SOURCE, source);
        payload.put(CHUNK_INDEX, chunkIndex);
        return payload;
    }

    public static ChunkPayload fromMap(Map<String, Object> payload) {
        Map<String, Object> metadata = new LinkedHashMap<>(payload);
        Object text = metadata.remove(TEXT);
        Object docId = metadata.remove(DOC_ID);
        Object source = metadata.remove(SOURCE);
        Object chunkIndex = metadata.remove(CHUNK_INDEX);
        return new ChunkPayload(
                text == null ? "" : text.toString(),
                docId == null ? null : docId.toString(),
                source == null ? null : source.toString(),
                chunkIndex instanceof Number n ? n.intValue() : -1,
                Collections.unmodifiableMap(metadata)
        );
    }
}
