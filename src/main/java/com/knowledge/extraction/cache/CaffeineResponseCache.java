package com.knowledge.extraction.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed response cache with a model index for targeted invalidation.
 */
public class CaffeineResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final Cache<CacheKey, String> cache;
    // modelId -> keys answered by that model
    private final ConcurrentMap<String, Set<CacheKey>> modelIndex = new ConcurrentHashMap<>();

    public CaffeineResponseCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((key, value, cause) -> {
                    if (key instanceof CacheKey ck) {
                        removeFromIndex(ck);
                    }
                })
                .build();
        log.info("CaffeineResponseCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(String modelId, String prompt) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(modelId, prompt)));
    }

    @Override
    public void put(String modelId, String prompt, String responseText) {
        if (responseText == null) {
            return;
        }
        CacheKey key = new CacheKey(modelId, prompt);
        cache.put(key, responseText);
        modelIndex.computeIfAbsent(modelId, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidateModel(String modelId) {
        Set<CacheKey> keys = modelIndex.remove(modelId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cached responses for model {}", keys.size(), modelId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        modelIndex.clear();
        log.debug("Invalidated all cached responses");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private void removeFromIndex(CacheKey key) {
        Set<CacheKey> keys = modelIndex.get(key.modelId());
        if (keys != null) {
            keys.remove(key);
        }
    }

    record CacheKey(String modelId, String prompt) {}
}
