package com.knowledge.extraction.core.model;

import java.util.Objects;

/**
 * A text chunk handed to the extraction pipeline by the upstream chunker.
 *
 * @param chunkId stable identifier of the chunk
 * @param text    the chunk text
 */
public record ChunkInput(String chunkId, String text) {

    public ChunkInput {
        Objects.requireNonNull(chunkId, "chunkId is required");
        Objects.requireNonNull(text, "text is required");
        if (chunkId.isBlank()) {
            throw new IllegalArgumentException("chunkId must not be blank");
        }
    }
}
