package com.knowledge.extraction.extract;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.GleaningRound;
import com.knowledge.extraction.core.model.Relationship;

import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one chunk, deduplicated within the chunk.
 * Produced by a worker and handed, immutable, to the single aggregator.
 *
 * @param chunkId                  the chunk
 * @param entities                 chunk-local unique entities
 * @param relations                chunk-local unique relationships
 * @param rawEntityCount           entities before chunk-local deduplication
 * @param rawRelationCount         relationships before chunk-local deduplication, gleaning included
 * @param entityRankUsed           cascade rank that produced the entities
 * @param relationRankUsed         cascade rank that produced the first-pass relations; 0 when skipped
 * @param gleaningRounds           gleaning rounds in order
 * @param modelCalls               model calls made for the chunk
 * @param latencyMs                summed model latency for the chunk
 */
public record ChunkExtractionResult(
        String chunkId,
        List<Entity> entities,
        List<Relationship> relations,
        int rawEntityCount,
        int rawRelationCount,
        int entityRankUsed,
        int relationRankUsed,
        List<GleaningRound> gleaningRounds,
        int modelCalls,
        long latencyMs
) {
    public ChunkExtractionResult {
        Objects.requireNonNull(chunkId, "chunkId is required");
        entities = List.copyOf(entities);
        relations = List.copyOf(relations);
        gleaningRounds = List.copyOf(gleaningRounds);
    }

    /**
     * Highest cascade rank either first-pass step needed.
     */
    public int highestRankUsed() {
        return Math.max(entityRankUsed, relationRankUsed);
    }

    /**
     * Number of relationships whose endpoint did not match a known entity.
     */
    public int unresolvedReferences() {
        return (int) relations.stream().filter(Relationship::isUnresolvedReference).count();
    }

    /**
     * Number of gleaning rounds that actually ran an extraction.
     */
    public int gleaningRoundsRun() {
        return (int) gleaningRounds.stream().filter(r -> !r.complete()).count();
    }
}
