package com.knowledge.extraction.cache;

import java.util.Optional;

/**
 * Cache of successful model responses, keyed by model id and the exact prompt.
 */
public interface ResponseCache {

    /**
     * @return the cached response text, or empty if the pair was never answered successfully
     */
    Optional<String> get(String modelId, String prompt);

    /**
     * Stores a successful response. Failed calls must never be cached.
     */
    void put(String modelId, String prompt, String responseText);

    /**
     * Drops every response produced by the given model, e.g. after a model upgrade.
     */
    void invalidateModel(String modelId);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache implementation matching the configuration.
     */
    static ResponseCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResponseCache(config) : new NoOpResponseCache();
    }
}
