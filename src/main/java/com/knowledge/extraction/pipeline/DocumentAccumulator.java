package com.knowledge.extraction.pipeline;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.dedup.Deduplicator;
import com.knowledge.extraction.dedup.MergeOutcome;
import com.knowledge.extraction.extract.ChunkExtractionResult;
import com.knowledge.extraction.metrics.ExtractionMetrics;
import com.knowledge.extraction.metrics.MetricsAggregator;
import com.knowledge.extraction.quality.QualityGate;
import com.knowledge.extraction.quality.QualityWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects the chunk results of one document.
 *
 * <p>Not thread-safe: one thread owns an accumulator and merges the chunk results
 * in chunk order. Chunk workers only ever hand over immutable
 * {@link ChunkExtractionResult}s.</p>
 */
public class DocumentAccumulator {

    private final String documentId;
    private final MetricsAggregator aggregator;
    private final QualityGate qualityGate;
    private final List<Entity> entities = new ArrayList<>();
    private final List<Relationship> relations = new ArrayList<>();
    private final List<QualityWarning> warnings = new ArrayList<>();
    private ExtractionMetrics running;

    public DocumentAccumulator(String documentId, MetricsAggregator aggregator, QualityGate qualityGate) {
        this.documentId = Objects.requireNonNull(documentId, "documentId is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.qualityGate = Objects.requireNonNull(qualityGate, "qualityGate is required");
    }

    /**
     * Merges a chunk result and applies the quality gate to the running figures.
     *
     * @throws com.knowledge.extraction.quality.ThresholdViolation if the document must be aborted
     */
    public void add(ChunkExtractionResult result) {
        entities.addAll(result.entities());
        relations.addAll(result.relations());
        running = aggregator.merge(running, aggregator.forChunk(result));
        qualityGate.observeChunk(documentId, result.chunkId(), result.relations().size())
                .ifPresent(warnings::add);
        qualityGate.checkEntityDensity(documentId, running);
    }

    /**
     * Runs document-level deduplication and returns the final result.
     */
    public DocumentExtractionResult finish(Deduplicator deduplicator) {
        MergeOutcome<Entity> mergedEntities = deduplicator.mergeEntities(entities);
        MergeOutcome<Relationship> mergedRelations = deduplicator.mergeRelations(relations);
        ExtractionMetrics summed = running != null ? running : ExtractionMetrics.empty();
        ExtractionMetrics metrics = aggregator.forDocument(summed, mergedEntities, mergedRelations);
        return new DocumentExtractionResult(documentId, mergedEntities.merged(), mergedRelations.merged(),
                metrics, warnings);
    }

    public ExtractionMetrics getRunningMetrics() {
        return running != null ? running : ExtractionMetrics.empty();
    }

    public String getDocumentId() {
        return documentId;
    }
}
