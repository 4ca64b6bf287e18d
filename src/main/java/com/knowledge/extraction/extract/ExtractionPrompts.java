package com.knowledge.extraction.extract;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prompt templates for entity, relationship and continuation extraction.
 * All prompts ask for a bare JSON array of flat objects.
 */
public final class ExtractionPrompts {

    private static final int MAX_LISTED_RELATIONS = 100;

    private ExtractionPrompts() {
        // templates
    }

    public static String entityPrompt(String text) {
        return """
                Extract the named entities from the text below.
                Return ONLY a JSON array. Each element must be an object with the fields
                "name", "type" (e.g. PERSON, ORGANIZATION, LOCATION, PRODUCT, EVENT, CONCEPT),
                "description" (one short sentence) and "confidence" (0.0 to 1.0).

                Text:
                """ + text + "\n";
    }

    /**
     * @param entityNames the entity names to offer the model, already capped by the caller
     */
    public static String relationPrompt(String text, List<String> entityNames) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Extract the relationships between the entities listed below, as stated in the text.\n");
        prompt.append("Only use these entities as source and target:\n");
        entityNames.forEach(name -> prompt.append("- ").append(name).append('\n'));
        prompt.append("""

                Return ONLY a JSON array. Each element must be an object with the fields
                "source", "target", "type" (UPPER_SNAKE_CASE, e.g. WORKS_FOR, LOCATED_IN),
                "description" (the sentence or clause stating the relationship) and
                "confidence" (0.0 to 1.0).

                Text:
                """);
        prompt.append(text).append('\n');
        return prompt.toString();
    }

    /**
     * Continuation prompt for a gleaning round: lists what is known and asks only for
     * relationships that are not in the list yet.
     */
    public static String continuationPrompt(String text, List<String> entityNames, List<Relationship> known) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Some relationships were MISSED in the previous extraction.\n");
        prompt.append("Entities:\n");
        entityNames.forEach(name -> prompt.append("- ").append(name).append('\n'));
        prompt.append("\nRelationships already extracted (do NOT repeat them):\n");
        known.stream().limit(MAX_LISTED_RELATIONS).forEach(r -> prompt.append("- ")
                .append(r.getSourceEntityRef()).append(" -[")
                .append(r.getType() != null ? r.getType() : "RELATED_TO")
                .append("]-> ").append(r.getTargetEntityRef()).append('\n'));
        prompt.append("""

                Return ONLY a JSON array of the ADDITIONAL relationships, using the same fields:
                "source", "target", "type", "description", "confidence".
                Return [] if nothing is missing.

                Text:
                """);
        prompt.append(text).append('\n');
        return prompt.toString();
    }

    /**
     * Returns the distinct entity names (by canonical key, first occurrence wins), at most {@code limit}.
     */
    public static List<String> distinctNames(List<Entity> entities, int limit) {
        Map<String, String> names = new LinkedHashMap<>();
        for (Entity entity : entities) {
            if (names.size() >= limit) {
                break;
            }
            names.putIfAbsent(entity.getCanonicalKey(), entity.getName());
        }
        return List.copyOf(names.values());
    }
}
