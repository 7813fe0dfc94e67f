package com.semsort.ingest;

/**
 * A call into the model runtime failed. Queue workers retry these with bounded attempts.
 */
public class EmbeddingBackendException extends RuntimeException {
    public EmbeddingBackendException(String message) {
        super(message);
    }

    public EmbeddingBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
