package com.knowledge.extraction.llm;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.ModelDescriptor;
import com.knowledge.extraction.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Asks a model whether relationships are missing. Anything other than a leading
 * {@code Y} counts as complete, as does a failed call, so a misbehaving model
 * never causes extra gleaning rounds.
 */
public class LLMCompletenessChecker implements CompletenessChecker {
    private static final Logger log = LoggerFactory.getLogger(LLMCompletenessChecker.class);

    private static final int MAX_LISTED_RELATIONS = 50;

    private final LLMProvider provider;
    private final ModelDescriptor model;

    public LLMCompletenessChecker(LLMProvider provider, ModelDescriptor model) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.model = Objects.requireNonNull(model, "model is required");
    }

    @Override
    public boolean isIncomplete(String text, List<Entity> entities, List<Relationship> relations) {
        String prompt = buildPrompt(text, entities, relations);
        try {
            LLMResponse response = provider.generate(model.modelId(), prompt, GenerationOptions.from(model));
            String answer = response.text().trim().toUpperCase(Locale.ROOT);
            boolean incomplete = answer.startsWith("Y");
            log.debug("Completeness check answered '{}' (incomplete={})", abbreviate(answer), incomplete);
            return incomplete;
        } catch (LLMException e) {
            log.warn("Completeness check failed, treating extraction as complete: {}", e.getMessage());
            return false;
        }
    }

    private String buildPrompt(String text, List<Entity> entities, List<Relationship> relations) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are checking a knowledge-graph extraction for completeness.\n\n");
        prompt.append("Text:\n").append(text).append("\n\n");
        prompt.append("Entities:\n");
        for (Entity entity : entities) {
            prompt.append("- ").append(entity.getName()).append(" (").append(entity.getType()).append(")\n");
        }
        prompt.append("\nRelationships:\n");
        relations.stream().limit(MAX_LISTED_RELATIONS).forEach(r -> prompt.append("- ")
                .append(r.getSourceEntityRef()).append(" -[")
                .append(r.getType() != null ? r.getType() : "?")
                .append("]-> ").append(r.getTargetEntityRef()).append('\n'));
        prompt.append("\nAre relationships between these entities still missing from the list? ");
        prompt.append("Answer with a single letter: Y or N.\n");
        return prompt.toString();
    }

    private static String abbreviate(String s) {
        return s.length() > 20 ? s.substring(0, 20) + "..." : s;
    }
}
