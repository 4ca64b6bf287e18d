package com.knowledge.extraction.llm;

/**
 * The provider did not answer within the requested timeout.
 */
public class LLMTimeoutException extends LLMException {

    public LLMTimeoutException(String message) {
        super(message);
    }

    public LLMTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
