package com.knowledge.extraction.lock;

/**
 * Configuration for lock implementations.
 *
 * @param timeoutMs      maximum time to wait for an in-process lock
 * @param maxRetries     retry attempts for graph-based locks
 * @param retryDelayMs   delay between retry attempts in milliseconds
 * @param lockTtlSeconds time-to-live of a graph lock node; must exceed the longest maintenance run
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 30s wait, 5 retries, 500ms delay, 15 minute TTL.
     */
    public static LockConfig defaults() {
        return new LockConfig(30_000, 5, 500, 900);
    }
}
