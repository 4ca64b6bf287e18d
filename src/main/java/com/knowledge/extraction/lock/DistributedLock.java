package com.knowledge.extraction.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion for graph writes. Ingestion upserts and consistency
 * maintenance both take {@link #GRAPH_WRITE_KEY}, so maintenance never runs
 * against a half-written document.
 */
public interface DistributedLock {

    /** Key shared by every writer of the knowledge graph. */
    String GRAPH_WRITE_KEY = "graph-write";

    /**
     * Attempts to acquire a lock on the given key.
     *
     * @param key the lock key
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured limits
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Runs the action while holding the lock on {@code key}.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired
     */
    default <T> T withLock(String key, Supplier<T> action) {
        if (!tryLock(key)) {
            throw new LockAcquisitionException("Lock '" + key + "' was not granted");
        }
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
