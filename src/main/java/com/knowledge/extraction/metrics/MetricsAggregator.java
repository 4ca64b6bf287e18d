package com.knowledge.extraction.metrics;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.RelationTypes;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.dedup.MergeOutcome;
import com.knowledge.extraction.extract.ChunkExtractionResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and combines {@link ExtractionMetrics}.
 *
 * <p>{@link #merge} adds every summed field, so it is associative and commutative;
 * derived ratios follow from the merged sums.</p>
 */
public class MetricsAggregator {

    static final String UNTYPED = "UNTYPED";

    public ExtractionMetrics forChunk(ChunkExtractionResult result) {
        List<Entity> entities = result.entities();
        List<Relationship> relations = result.relations();
        int rank = result.highestRankUsed();
        Map<Integer, Integer> ranks = rank > 0 ? Map.of(rank, 1) : Map.of();
        return new ExtractionMetrics(
                1,
                entities.size(),
                relations.size(),
                countGeneric(relations),
                result.rawEntityCount(),
                result.rawRelationCount(),
                result.rawEntityCount() - entities.size(),
                result.unresolvedReferences(),
                relations.isEmpty() ? 1 : 0,
                result.gleaningRoundsRun(),
                result.modelCalls(),
                result.latencyMs(),
                entityTypes(entities),
                relationTypes(relations),
                ranks);
    }

    /**
     * Adds two sets of figures.
     *
     * @param existing the figures so far, or null for none
     * @param next     the figures to add
     */
    public ExtractionMetrics merge(ExtractionMetrics existing, ExtractionMetrics next) {
        if (existing == null) {
            return next;
        }
        return new ExtractionMetrics(
                existing.chunksProcessed() + next.chunksProcessed(),
                existing.entitiesTotal() + next.entitiesTotal(),
                existing.relationsTotal() + next.relationsTotal(),
                existing.genericRelations() + next.genericRelations(),
                existing.rawEntities() + next.rawEntities(),
                existing.rawRelations() + next.rawRelations(),
                existing.duplicatesRemoved() + next.duplicatesRemoved(),
                existing.unresolvedReferences() + next.unresolvedReferences(),
                existing.zeroRelationChunks() + next.zeroRelationChunks(),
                existing.gleaningRounds() + next.gleaningRounds(),
                existing.modelCalls() + next.modelCalls(),
                existing.totalLatencyMs() + next.totalLatencyMs(),
                add(existing.entityTypeHistogram(), next.entityTypeHistogram()),
                add(existing.relationTypeHistogram(), next.relationTypeHistogram()),
                add(existing.cascadeRankHistogram(), next.cascadeRankHistogram()));
    }

    /**
     * Replaces the summed per-chunk totals with the figures after document-level
     * deduplication. Process counters (chunks, calls, latency, gleaning, ranks) are kept.
     */
    public ExtractionMetrics forDocument(ExtractionMetrics summed, MergeOutcome<Entity> entities,
                                         MergeOutcome<Relationship> relations) {
        List<Relationship> merged = relations.merged();
        return new ExtractionMetrics(
                summed.chunksProcessed(),
                entities.merged().size(),
                merged.size(),
                countGeneric(merged),
                summed.rawEntities(),
                summed.rawRelations(),
                summed.duplicatesRemoved() + entities.duplicatesRemoved(),
                (int) merged.stream().filter(Relationship::isUnresolvedReference).count(),
                summed.zeroRelationChunks(),
                summed.gleaningRounds(),
                summed.modelCalls(),
                summed.totalLatencyMs(),
                entityTypes(entities.merged()),
                relationTypes(merged),
                summed.cascadeRankHistogram());
    }

    private static int countGeneric(List<Relationship> relations) {
        return (int) relations.stream().filter(r -> RelationTypes.isGeneric(r.getType())).count();
    }

    private static Map<String, Integer> entityTypes(List<Entity> entities) {
        Map<String, Integer> histogram = new HashMap<>();
        entities.forEach(e -> histogram.merge(e.getType(), 1, Integer::sum));
        return histogram;
    }

    private static Map<String, Integer> relationTypes(List<Relationship> relations) {
        Map<String, Integer> histogram = new HashMap<>();
        relations.forEach(r -> histogram.merge(r.getType() != null ? r.getType() : UNTYPED, 1, Integer::sum));
        return histogram;
    }

    private static <K> Map<K, Integer> add(Map<K, Integer> a, Map<K, Integer> b) {
        Map<K, Integer> sum = new HashMap<>(a);
        b.forEach((key, count) -> sum.merge(key, count, Integer::sum));
        return sum;
    }
}
