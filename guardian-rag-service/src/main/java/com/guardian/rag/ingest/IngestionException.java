package com.guardian.rag.ingest;

/**
 * Raised when a document cannot be turned into chunks: unreadable file,
 * no extractable text, or invalid metadata. Nothing has been written to the
 * index when this is thrown.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
