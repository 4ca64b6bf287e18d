package com.knowledge.extraction.tracing;

/**
 * A unit of work in a trace, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("extraction.chunk")) {
 *     span.setAttribute("chunkId", chunk.chunkId());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
