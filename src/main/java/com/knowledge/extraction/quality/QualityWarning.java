package com.knowledge.extraction.quality;

/**
 * A soft quality signal. Logged and surfaced in the document result; never aborts.
 *
 * @param documentId document the warning is about
 * @param chunkId    chunk that triggered it
 * @param kind       warning kind, e.g. {@code zero-relation-streak}
 * @param message    human-readable description
 */
public record QualityWarning(String documentId, String chunkId, String kind, String message) {

    public static final String ZERO_RELATION_STREAK = "zero-relation-streak";
}
