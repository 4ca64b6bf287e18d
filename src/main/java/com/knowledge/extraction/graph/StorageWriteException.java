package com.knowledge.extraction.graph;

/**
 * Wraps a failure to write to graph storage. Writes are idempotent, so the
 * caller may retry the whole batch.
 */
public class StorageWriteException extends RuntimeException {

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
