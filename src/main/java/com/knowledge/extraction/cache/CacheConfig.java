package com.knowledge.extraction.cache;

/**
 * Configuration for the model response cache.
 *
 * @param maxSize    maximum number of cached responses
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 5,000 responses, one hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
