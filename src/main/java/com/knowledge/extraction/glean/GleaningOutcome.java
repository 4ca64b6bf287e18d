package com.knowledge.extraction.glean;

import com.knowledge.extraction.core.model.GleaningRound;
import com.knowledge.extraction.core.model.Relationship;

import java.util.List;

/**
 * Relationships after gleaning.
 *
 * @param relations         the first-pass relationships followed by every relationship gleaned
 * @param rounds            the rounds that were evaluated, in order
 * @param relationCalls     relation-extraction runs made by gleaning (excluding the first pass)
 * @param modelCalls        model calls made by those runs
 * @param latencyMs         summed latency of those runs
 */
public record GleaningOutcome(
        List<Relationship> relations,
        List<GleaningRound> rounds,
        int relationCalls,
        int modelCalls,
        long latencyMs
) {
    public GleaningOutcome {
        relations = List.copyOf(relations);
        rounds = List.copyOf(rounds);
    }

    public static GleaningOutcome unchanged(List<Relationship> relations) {
        return new GleaningOutcome(relations, List.of(), 0, 0, 0);
    }

    public int newRelationsFound() {
        return rounds.stream().mapToInt(GleaningRound::newRelationsFound).sum();
    }
}
