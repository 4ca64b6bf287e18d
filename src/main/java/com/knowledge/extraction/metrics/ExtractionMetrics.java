package com.knowledge.extraction.metrics;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Extraction quality figures for a chunk, a running document or a finished document.
 *
 * <p>Only sums are stored. Ratios are derived on demand from the sums, so merging
 * two instances never averages ratios.</p>
 *
 * @param chunksProcessed       chunks merged into these figures
 * @param entitiesTotal         unique entities
 * @param relationsTotal        unique relationships
 * @param genericRelations      relationships that are untyped or {@code RELATED_TO}
 * @param rawEntities           entities before any deduplication
 * @param rawRelations          relationships before any deduplication
 * @param duplicatesRemoved     entities removed by deduplication
 * @param unresolvedReferences  relationships with an endpoint that matched no entity
 * @param zeroRelationChunks    chunks that yielded no relationship
 * @param gleaningRounds        gleaning rounds that ran an extraction
 * @param modelCalls            model calls, cached ones included
 * @param totalLatencyMs        summed model latency
 * @param entityTypeHistogram   entity type to count
 * @param relationTypeHistogram relationship type to count
 * @param cascadeRankHistogram  cascade rank to number of chunks resolved at that rank
 */
public record ExtractionMetrics(
        int chunksProcessed,
        int entitiesTotal,
        int relationsTotal,
        int genericRelations,
        int rawEntities,
        int rawRelations,
        int duplicatesRemoved,
        int unresolvedReferences,
        int zeroRelationChunks,
        int gleaningRounds,
        int modelCalls,
        long totalLatencyMs,
        Map<String, Integer> entityTypeHistogram,
        Map<String, Integer> relationTypeHistogram,
        Map<Integer, Integer> cascadeRankHistogram
) {
    public ExtractionMetrics {
        entityTypeHistogram = Map.copyOf(Objects.requireNonNull(entityTypeHistogram, "entityTypeHistogram"));
        relationTypeHistogram = Map.copyOf(Objects.requireNonNull(relationTypeHistogram, "relationTypeHistogram"));
        cascadeRankHistogram = Map.copyOf(Objects.requireNonNull(cascadeRankHistogram, "cascadeRankHistogram"));
        if (chunksProcessed < 0 || entitiesTotal < 0 || relationsTotal < 0 || rawEntities < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    public static ExtractionMetrics empty() {
        return new ExtractionMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0L, Map.of(), Map.of(), Map.of());
    }

    /**
     * Relationships per entity.
     */
    public double relationRatio() {
        return (double) relationsTotal / Math.max(1, entitiesTotal);
    }

    /**
     * Share of relationships carrying a specific (non-generic) type.
     */
    public double typedCoverage() {
        return (double) (relationsTotal - genericRelations) / Math.max(1, relationsTotal);
    }

    /**
     * Share of raw entities that deduplication removed.
     */
    public double duplicationRate() {
        return (double) duplicatesRemoved / Math.max(1, rawEntities);
    }

    /**
     * Unique entities per processed chunk, 0 when no chunk was processed.
     */
    public double entitiesPerChunk() {
        return chunksProcessed == 0 ? 0.0 : (double) entitiesTotal / chunksProcessed;
    }

    /**
     * Highest cascade rank any chunk needed, 0 when no chunk was resolved.
     */
    public int cascadeRankUsed() {
        return cascadeRankHistogram.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .mapToInt(Map.Entry::getKey)
                .max()
                .orElse(0);
    }

    public double averageLatencyMs() {
        return modelCalls == 0 ? 0.0 : (double) totalLatencyMs / modelCalls;
    }

    @Override
    public String toString() {
        return "ExtractionMetrics{" +
                "chunks=" + chunksProcessed +
                ", entities=" + entitiesTotal +
                ", relations=" + relationsTotal +
                ", relationRatio=" + String.format(Locale.ROOT, "%.3f", relationRatio()) +
                ", typedCoverage=" + String.format(Locale.ROOT, "%.3f", typedCoverage()) +
                ", duplicationRate=" + String.format(Locale.ROOT, "%.3f", duplicationRate()) +
                ", cascadeRankUsed=" + cascadeRankUsed() +
                '}';
    }
}
