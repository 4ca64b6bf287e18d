package com.knowledge.extraction.pipeline;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.metrics.ExtractionMetrics;
import com.knowledge.extraction.quality.QualityWarning;

import java.util.List;
import java.util.Objects;

/**
 * Deduplicated output of one document.
 *
 * @param documentId document identifier
 * @param entities   unique entities of the document
 * @param relations  unique relationships of the document
 * @param metrics    document-level metrics
 * @param warnings   soft quality warnings raised while aggregating
 */
public record DocumentExtractionResult(
        String documentId,
        List<Entity> entities,
        List<Relationship> relations,
        ExtractionMetrics metrics,
        List<QualityWarning> warnings
) {
    public DocumentExtractionResult {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(metrics, "metrics is required");
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
