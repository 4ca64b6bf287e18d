package com.knowledge.extraction.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One model call (or one deterministic fallback run) made while resolving a cascade.
 *
 * @param rank      cascade rank of the attempt (1..3)
 * @param modelId   model that was called
 * @param latencyMs wall-clock latency of the attempt
 * @param succeeded whether the attempt returned text
 * @param chunkId   chunk the attempt was made for
 * @param cascadeId identifier shared by all attempts of one cascade run
 * @param outcome   detailed outcome
 * @param timestamp when the attempt finished
 */
public record CascadeAttempt(
        int rank,
        String modelId,
        long latencyMs,
        boolean succeeded,
        String chunkId,
        String cascadeId,
        Outcome outcome,
        Instant timestamp
) {
    public CascadeAttempt {
        Objects.requireNonNull(modelId, "modelId is required");
        Objects.requireNonNull(cascadeId, "cascadeId is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (rank < 1 || rank > ModelDescriptor.FALLBACK_RANK) {
            throw new IllegalArgumentException("rank must be between 1 and 3");
        }
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public enum Outcome {
        SUCCESS,
        CACHED,
        TIMEOUT,
        TRANSPORT_ERROR,
        CANCELLED;

        public boolean isSuccess() {
            return this == SUCCESS || this == CACHED;
        }
    }
}
