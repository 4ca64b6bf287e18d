package com.knowledge.extraction.graph;

import java.util.regex.Pattern;

/**
 * Checks on model output before it is written to the graph. Entity names and
 * relation types come straight from LLM answers and are treated as untrusted.
 */
public final class InputSanitizer {

    /** Maximum allowed length for entity names. */
    public static final int MAX_ENTITY_NAME_LENGTH = 1000;

    /** Maximum allowed length for string values written through Cypher. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private static final Pattern RELATION_TYPE = Pattern.compile("[A-Za-z0-9_]+");
    // ASCII control characters except tab, newline and carriage return
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private InputSanitizer() {
    }

    /**
     * @throws IllegalArgumentException if the name is null, blank, longer than
     *                                  {@link #MAX_ENTITY_NAME_LENGTH} or contains control characters
     */
    public static void validateEntityName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be null or blank");
        }
        if (name.length() > MAX_ENTITY_NAME_LENGTH) {
            throw new IllegalArgumentException("Entity name exceeds maximum length of "
                    + MAX_ENTITY_NAME_LENGTH + " characters (was " + name.length() + ")");
        }
        if (CONTROL_CHARACTERS.matcher(name).find()) {
            throw new IllegalArgumentException("Entity name must not contain control characters");
        }
    }

    /**
     * Relation types end up in maintenance reports and metric tags, so only
     * alphanumerics and underscores are accepted. Null means untyped.
     *
     * @throws IllegalArgumentException if the type is invalid
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType != null && !RELATION_TYPE.matcher(relationshipType).matches()) {
            throw new IllegalArgumentException("Relationship type must contain only alphanumeric characters "
                    + "and underscores, got: '" + relationshipType + "'");
        }
    }

    /**
     * Cuts evidence text down to {@link #MAX_CYPHER_VALUE_LENGTH}.
     */
    public static String truncate(String value) {
        if (value == null || value.length() <= MAX_CYPHER_VALUE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_CYPHER_VALUE_LENGTH);
    }
}
