package com.knowledge.extraction.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * MDC wrapper that removes its keys on close, so the extraction context of one
 * document or chunk never leaks into log lines of the next task on the same thread.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forChunk(documentId, chunk.chunkId())) {
 *     log.info("extraction.chunk.completed entities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forDocument(String documentId) {
        LogContext ctx = new LogContext();
        ctx.put("documentId", documentId);
        ctx.put("operation", "extract");
        return ctx;
    }

    public static LogContext forChunk(String documentId, String chunkId) {
        LogContext ctx = new LogContext();
        if (documentId != null) {
            ctx.put("documentId", documentId);
        }
        ctx.put("chunkId", chunkId);
        ctx.put("operation", "extract");
        return ctx;
    }

    public static LogContext forMaintenance(String runId, boolean dryRun) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("dryRun", Boolean.toString(dryRun));
        ctx.put("operation", "maintenance");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
