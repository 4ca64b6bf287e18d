package com.knowledge.extraction.core.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical key derivation for entities and relationships.
 *
 * <p>An entity key is the lower-cased, trimmed surface name with runs of whitespace
 * collapsed to a single space. The entity type is deliberately not part of the key:
 * "Apple" the company and "Apple" the fruit merge, and the first-seen type wins.</p>
 */
public final class CanonicalKeys {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char KEY_SEPARATOR = '\u001F';

    private CanonicalKeys() {
        // utility class
    }

    /**
     * Returns the canonical key for an entity name, or an empty string for null input.
     */
    public static String entityKey(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the merge key for a relationship: normalized source, normalized target and type.
     * A null type keys as the empty string.
     */
    public static String relationKey(String source, String target, String type) {
        return entityKey(source) + KEY_SEPARATOR + entityKey(target) + KEY_SEPARATOR
                + (type == null ? "" : type);
    }

    /**
     * Returns the merge key of the given relationship.
     */
    public static String relationKey(Relationship relationship) {
        return relationKey(relationship.getSourceEntityRef(), relationship.getTargetEntityRef(),
                relationship.getType());
    }
}
