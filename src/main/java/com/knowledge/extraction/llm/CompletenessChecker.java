package com.knowledge.extraction.llm;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.List;

/**
 * Decides whether relationships are still missing from what was extracted for a text.
 */
@FunctionalInterface
public interface CompletenessChecker {

    /**
     * @param text      the chunk text
     * @param entities  entities known so far
     * @param relations relations known so far
     * @return true if relationships are likely missing and another gleaning round is worthwhile
     */
    boolean isIncomplete(String text, List<Entity> entities, List<Relationship> relations);

    /**
     * A checker that always reports the extraction as complete, disabling gleaning.
     */
    CompletenessChecker ALWAYS_COMPLETE = (text, entities, relations) -> false;
}
