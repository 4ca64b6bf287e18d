package com.knowledge.extraction.llm;

import com.knowledge.extraction.core.model.ModelDescriptor;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call generation options.
 *
 * @param temperature sampling temperature
 * @param maxTokens   maximum number of generated tokens
 * @param timeout     transport-level timeout
 */
public record GenerationOptions(double temperature, int maxTokens, Duration timeout) {

    public GenerationOptions {
        Objects.requireNonNull(timeout, "timeout is required");
        if (temperature < 0.0) {
            throw new IllegalArgumentException("temperature must be >= 0");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
    }

    public static GenerationOptions from(ModelDescriptor model) {
        return new GenerationOptions(model.temperature(), model.maxTokens(), model.timeout());
    }
}
