package com.knowledge.extraction.lock;

/**
 * Thrown when the graph-write lock cannot be acquired within the configured limits.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
