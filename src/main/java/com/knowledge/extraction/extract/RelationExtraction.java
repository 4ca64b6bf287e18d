package com.knowledge.extraction.extract;

import com.knowledge.extraction.core.model.Relationship;

import java.util.List;

/**
 * Relationships produced by one run of the relation cascade for a chunk.
 *
 * @param relations  valid relationships, before deduplication
 * @param rankUsed   rank that produced them; 0 when the cascade was skipped
 * @param modelCalls number of model calls made, cached ones included
 * @param latencyMs  summed latency of those calls and of the fallback run
 */
public record RelationExtraction(List<Relationship> relations, int rankUsed, int modelCalls, long latencyMs) {

    public RelationExtraction {
        relations = List.copyOf(relations);
    }

    /**
     * The result when there was nothing to relate.
     */
    public static RelationExtraction skipped() {
        return new RelationExtraction(List.of(), 0, 0, 0);
    }
}
