package com.knowledge.extraction.invoke;

import com.knowledge.extraction.core.model.CascadeAttempt.Outcome;

import java.util.Objects;

/**
 * Result of a single model call.
 *
 * @param outcome   how the call ended
 * @param text      generated text; null unless the outcome is a success
 * @param latencyMs wall-clock latency, 0 for cached responses
 * @param modelId   model that was called
 * @param rank      cascade rank of the model
 */
public record InvocationResult(Outcome outcome, String text, long latencyMs, String modelId, int rank) {

    public InvocationResult {
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome.isSuccess() && text == null) {
            throw new IllegalArgumentException("a successful invocation must carry text");
        }
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
