package com.knowledge.extraction.quality;

import com.knowledge.extraction.metrics.ExtractionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fail-fast quality checks applied while a document is being aggregated.
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final String ENTITY_DENSITY = "minEntitiesPerChunk";

    private final QualityGateConfig config;
    // documentId -> current run of consecutive zero-relation chunks
    private final ConcurrentMap<String, Integer> zeroRelationStreaks = new ConcurrentHashMap<>();

    public QualityGate(QualityGateConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public QualityGate() {
        this(QualityGateConfig.defaults());
    }

    /**
     * Checks the running entities-per-chunk of a document.
     *
     * @param running summed metrics of the chunks merged so far
     * @throws ThresholdViolation if the density is below {@code minEntitiesPerChunk}
     */
    public void checkEntityDensity(String documentId, ExtractionMetrics running) {
        if (running.chunksProcessed() == 0) {
            return;
        }
        double observed = running.entitiesPerChunk();
        if (observed < config.getMinEntitiesPerChunk()) {
            log.warn("quality.threshold.violated documentId={} threshold={} required={} observed={} chunks={}",
                    documentId, ENTITY_DENSITY, config.getMinEntitiesPerChunk(), observed,
                    running.chunksProcessed());
            throw new ThresholdViolation(documentId, ENTITY_DENSITY, config.getMinEntitiesPerChunk(), observed);
        }
    }

    /**
     * Tracks consecutive chunks without relationships.
     *
     * @return a warning when the streak reaches the configured length
     */
    public Optional<QualityWarning> observeChunk(String documentId, String chunkId, int relationsFound) {
        if (relationsFound > 0) {
            zeroRelationStreaks.remove(documentId);
            return Optional.empty();
        }
        int streak = zeroRelationStreaks.merge(documentId, 1, Integer::sum);
        if (streak == config.getZeroRelationStreakWarning()) {
            String message = streak + " consecutive chunks without relationships";
            log.warn("quality.zero_relation_streak documentId={} chunkId={} streak={}", documentId, chunkId, streak);
            return Optional.of(new QualityWarning(documentId, chunkId, QualityWarning.ZERO_RELATION_STREAK, message));
        }
        log.info("quality.zero_relation_chunk documentId={} chunkId={} streak={}", documentId, chunkId, streak);
        return Optional.empty();
    }

    /**
     * Drops the per-document state once a document is finished or aborted.
     */
    public void endDocument(String documentId) {
        zeroRelationStreaks.remove(documentId);
    }

    public QualityGateConfig getConfig() {
        return config;
    }
}
