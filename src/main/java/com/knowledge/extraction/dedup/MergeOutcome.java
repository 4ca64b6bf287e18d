package com.knowledge.extraction.dedup;

import java.util.List;
import java.util.Objects;

/**
 * Result of deduplicating a list of entities or relationships.
 *
 * @param merged            unique items in first-seen order
 * @param rawCount          number of items before deduplication
 * @param duplicatesRemoved {@code rawCount - merged.size()}
 * @param <T>               entity or relationship
 */
public record MergeOutcome<T>(List<T> merged, int rawCount, int duplicatesRemoved) {

    public MergeOutcome {
        Objects.requireNonNull(merged, "merged is required");
        merged = List.copyOf(merged);
        if (duplicatesRemoved != rawCount - merged.size()) {
            throw new IllegalArgumentException("duplicatesRemoved must equal rawCount - merged size");
        }
    }

    public static <T> MergeOutcome<T> of(List<T> merged, int rawCount) {
        return new MergeOutcome<>(merged, rawCount, rawCount - merged.size());
    }
}
