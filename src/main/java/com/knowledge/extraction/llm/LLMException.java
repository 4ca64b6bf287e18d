package com.knowledge.extraction.llm;

/**
 * Raised by an {@link LLMProvider} when a generation call does not produce text.
 */
public class LLMException extends Exception {

    public LLMException(String message) {
        super(message);
    }

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
