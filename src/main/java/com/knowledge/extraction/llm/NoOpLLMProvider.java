package com.knowledge.extraction.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider used when no model is configured. Every call fails with a transport error,
 * which sends the cascade straight to the deterministic fallback.
 */
public class NoOpLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMProvider.class);

    @Override
    public LLMResponse generate(String modelId, String prompt, GenerationOptions options)
            throws LLMException {
        log.debug("NoOp LLM provider called for model '{}'", modelId);
        throw new LLMTransportException("No LLM provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
