package com.knowledge.extraction.llm;

import java.util.Objects;

/**
 * Text generated by a provider together with its token accounting.
 */
public record LLMResponse(String text, int inputTokens, int outputTokens, long latencyMs) {

    public LLMResponse {
        Objects.requireNonNull(text, "text is required");
    }

    public static LLMResponse of(String text) {
        return new LLMResponse(text, 0, 0, 0);
    }
}
