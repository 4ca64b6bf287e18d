package com.knowledge.extraction.tracing;

import java.util.Map;

/**
 * Opens spans around documents, chunks and maintenance runs.
 * {@link NoOpTracingService} is used unless a tracer is supplied.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
