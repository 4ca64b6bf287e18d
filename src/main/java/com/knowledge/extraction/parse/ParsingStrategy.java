package com.knowledge.extraction.parse;

import java.util.List;
import java.util.Optional;

/**
 * A pure function that tries to recover records from raw model output.
 */
@FunctionalInterface
public interface ParsingStrategy {

    /**
     * @param raw the model response text, never null
     * @return the recovered records, or empty if this strategy cannot read the text
     */
    Optional<List<ExtractedRecord>> parse(String raw);
}
