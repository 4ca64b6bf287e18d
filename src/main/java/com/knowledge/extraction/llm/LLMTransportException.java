package com.knowledge.extraction.llm;

/**
 * The provider could not be reached or answered with an error.
 */
public class LLMTransportException extends LLMException {

    public LLMTransportException(String message) {
        super(message);
    }

    public LLMTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
