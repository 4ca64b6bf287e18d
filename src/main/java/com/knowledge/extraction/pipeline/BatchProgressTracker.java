package com.knowledge.extraction.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks chunk progress of running batches. Create one instance and hand it to
 * every pipeline that should report into it.
 */
public class BatchProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(BatchProgressTracker.class);

    private final ConcurrentHashMap<String, BatchProgress> batches = new ConcurrentHashMap<>();

    /**
     * Registers a batch.
     *
     * @throws IllegalStateException if a batch with the same id is already running
     */
    public void startBatch(String batchId, int totalChunks) {
        Objects.requireNonNull(batchId, "batchId is required");
        if (totalChunks < 0) {
            throw new IllegalArgumentException("totalChunks must be >= 0");
        }
        BatchProgress previous = batches.putIfAbsent(batchId,
                new BatchProgress(batchId, totalChunks, 0, Instant.now()));
        if (previous != null) {
            throw new IllegalStateException("Batch already running: " + batchId);
        }
        log.debug("progress.batch.started batchId={} totalChunks={}", batchId, totalChunks);
    }

    /**
     * Counts one more merged chunk. Unknown batch ids are ignored.
     */
    public void chunkCompleted(String batchId) {
        batches.computeIfPresent(batchId, (id, p) ->
                new BatchProgress(id, p.totalChunks(), p.completedChunks() + 1, p.startedAt()));
    }

    public Optional<BatchProgress> get(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public void removeBatch(String batchId) {
        if (batches.remove(batchId) != null) {
            log.debug("progress.batch.removed batchId={}", batchId);
        }
    }

    public Map<String, BatchProgress> activeBatches() {
        return Map.copyOf(batches);
    }
}
