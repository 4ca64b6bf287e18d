package com.knowledge.extraction.llm;

/**
 * Transport to a text-generation model.
 * Implementations perform exactly one call per invocation; retries and fallback
 * between models are the caller's concern.
 */
public interface LLMProvider {

    /**
     * Generates a completion for the prompt.
     *
     * @param modelId the model to call
     * @param prompt  the full prompt
     * @param options temperature, token budget and timeout
     * @return the generated text and token accounting
     * @throws LLMTimeoutException   if the model did not answer in time
     * @throws LLMTransportException if the model could not be reached or failed
     */
    LLMResponse generate(String modelId, String prompt, GenerationOptions options) throws LLMException;

    /**
     * Returns the name/identifier of this LLM provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is available and configured.
     */
    boolean isAvailable();
}
