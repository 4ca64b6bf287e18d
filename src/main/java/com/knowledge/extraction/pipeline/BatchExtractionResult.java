package com.knowledge.extraction.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of {@link ExtractionPipeline#processDocuments}. Every document ends up in
 * exactly one of the two maps, both in submission order.
 *
 * @param results  finished documents by id
 * @param failures aborted or failed documents by id
 */
public record BatchExtractionResult(
        Map<String, DocumentExtractionResult> results,
        Map<String, RuntimeException> failures
) {
    public BatchExtractionResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isAllSucceeded() {
        return failures.isEmpty();
    }

    public int totalDocuments() {
        return results.size() + failures.size();
    }
}
