package com.knowledge.extraction.extract;

import com.knowledge.extraction.core.model.Entity;

import java.util.List;

/**
 * Entities produced by one run of the entity cascade for a chunk.
 *
 * @param entities   valid entities, before deduplication
 * @param rankUsed   rank that produced them (1, 2 or 3)
 * @param modelCalls number of model calls made, cached ones included
 * @param latencyMs  summed latency of those calls and of the fallback run
 */
public record EntityExtraction(List<Entity> entities, int rankUsed, int modelCalls, long latencyMs) {

    public EntityExtraction {
        entities = List.copyOf(entities);
    }
}
