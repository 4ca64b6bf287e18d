package com.knowledge.extraction.pipeline;

import java.time.Instant;

/**
 * Snapshot of a batch's progress.
 *
 * @param batchId         batch identifier, the document id for extraction runs
 * @param totalChunks     chunks in the batch
 * @param completedChunks chunks merged so far
 * @param startedAt       when the batch was started
 */
public record BatchProgress(String batchId, int totalChunks, int completedChunks, Instant startedAt) {

    public boolean isComplete() {
        return completedChunks >= totalChunks;
    }

    public double fraction() {
        return totalChunks == 0 ? 1.0 : (double) completedChunks / totalChunks;
    }
}
