package com.knowledge.extraction.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A ranked model taking part in the extraction cascade.
 *
 * @param modelId     provider-specific model identifier
 * @param rank        cascade rank, 1 (tried first) or 2; rank 3 is reserved for the deterministic fallback
 * @param timeout     bound on a single call to this model
 * @param temperature sampling temperature
 * @param maxTokens   maximum number of tokens to generate
 */
public record ModelDescriptor(String modelId, int rank, Duration timeout, double temperature, int maxTokens) {

    public static final int FALLBACK_RANK = 3;

    private static final double DEFAULT_TEMPERATURE = 0.1;
    private static final int DEFAULT_MAX_TOKENS = 4096;

    public ModelDescriptor {
        Objects.requireNonNull(modelId, "modelId is required");
        Objects.requireNonNull(timeout, "timeout is required");
        if (rank < 1 || rank >= FALLBACK_RANK) {
            throw new IllegalArgumentException("rank must be 1 or 2, got " + rank);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
    }

    /**
     * Creates a descriptor with the default temperature and token budget.
     */
    public static ModelDescriptor of(String modelId, int rank, Duration timeout) {
        return new ModelDescriptor(modelId, rank, timeout, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }
}
