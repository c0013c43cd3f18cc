package com.guardian.rag.index;

/**
 * Failure of the vector index: unreachable server, rejected request, or a
 * vector whose dimension does not match its collection.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
