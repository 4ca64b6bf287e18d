package com.knowledge.extraction.cache;

import java.util.Optional;

/**
 * Cache that never stores anything. Default when response caching is disabled.
 */
public class NoOpResponseCache implements ResponseCache {

    @Override
    public Optional<String> get(String modelId, String prompt) {
        return Optional.empty();
    }

    @Override
    public void put(String modelId, String prompt, String responseText) {
        // no-op
    }

    @Override
    public void invalidateModel(String modelId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
