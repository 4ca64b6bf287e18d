package com.knowledge.extraction.core.model;

/**
 * Result of one gleaning round for a chunk.
 *
 * @param roundIndex         1-based index of the continuation round
 * @param newRelationsFound  relations found in this round that were not already known
 * @param complete           what the completeness check answered before the round
 */
public record GleaningRound(int roundIndex, int newRelationsFound, boolean complete) {

    /**
     * Whether gleaning must stop after this round.
     */
    public boolean isTerminal(int maxRounds) {
        return complete || roundIndex >= maxRounds || newRelationsFound == 0;
    }
}
