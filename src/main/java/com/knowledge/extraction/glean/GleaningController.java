package com.knowledge.extraction.glean;

import com.knowledge.extraction.core.model.CancellationToken;
import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.GleaningRound;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.extract.ExtractionPrompts;
import com.knowledge.extraction.extract.RelationExtraction;
import com.knowledge.extraction.llm.CompletenessChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Quality-gated gleaning: after the first relation pass, asks the completeness
 * checker whether relationships are missing and, only if so, runs a continuation
 * round through the relation cascade.
 *
 * <p>Stops as soon as the checker answers complete, {@code maxRounds} rounds have run,
 * or a round finds no new relationship, so a chunk costs at most {@code maxRounds + 1}
 * relation extractions.</p>
 */
public class GleaningController {
    private static final Logger log = LoggerFactory.getLogger(GleaningController.class);

    private final RelationCascade cascade;
    private final CompletenessChecker checker;
    private final GleaningConfig config;
    private final int maxEntitiesInPrompt;

    public GleaningController(RelationCascade cascade, CompletenessChecker checker,
                              GleaningConfig config, int maxEntitiesInPrompt) {
        this.cascade = Objects.requireNonNull(cascade, "cascade is required");
        this.checker = Objects.requireNonNull(checker, "checker is required");
        this.config = Objects.requireNonNull(config, "config is required");
        if (maxEntitiesInPrompt <= 0) {
            throw new IllegalArgumentException("maxEntitiesInPrompt must be > 0");
        }
        this.maxEntitiesInPrompt = maxEntitiesInPrompt;
    }

    public GleaningOutcome glean(ChunkInput chunk, List<Entity> entities, List<Relationship> relations,
                                 CancellationToken token) {
        if (!config.isEnabled() || entities.isEmpty()) {
            return GleaningOutcome.unchanged(relations);
        }

        List<Relationship> all = new ArrayList<>(relations);
        Set<String> knownKeys = new HashSet<>();
        relations.forEach(r -> knownKeys.add(r.getMergeKey()));
        List<String> entityNames = ExtractionPrompts.distinctNames(entities, maxEntitiesInPrompt);

        List<GleaningRound> rounds = new ArrayList<>();
        int relationCalls = 0;
        int modelCalls = 0;
        long latencyMs = 0;

        for (int round = 1; round <= config.maxRounds(); round++) {
            if (!checker.isIncomplete(chunk.text(), entities, all)) {
                rounds.add(new GleaningRound(round, 0, true));
                log.debug("gleaning.complete chunkId={} round={}", chunk.chunkId(), round);
                break;
            }

            String prompt = ExtractionPrompts.continuationPrompt(chunk.text(), entityNames, all);
            RelationExtraction extraction = cascade.extractRelations(chunk, entities, prompt, token);
            relationCalls++;
            modelCalls += extraction.modelCalls();
            latencyMs += extraction.latencyMs();

            int found = 0;
            for (Relationship relation : extraction.relations()) {
                all.add(relation);
                if (knownKeys.add(relation.getMergeKey())) {
                    found++;
                }
            }
            GleaningRound gleaningRound = new GleaningRound(round, found, false);
            rounds.add(gleaningRound);
            log.debug("gleaning.round chunkId={} round={} newRelations={}", chunk.chunkId(), round, found);
            if (gleaningRound.isTerminal(config.maxRounds())) {
                break;
            }
        }
        return new GleaningOutcome(all, rounds, relationCalls, modelCalls, latencyMs);
    }
}
