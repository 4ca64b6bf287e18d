package com.knowledge.extraction.core.model;

/**
 * Relationship type constants shared by extraction, metrics and maintenance.
 */
public final class RelationTypes {

    /** Type assigned when no specific type could be determined. */
    public static final String GENERIC = "RELATED_TO";

    private RelationTypes() {
        // constants
    }

    /**
     * Whether the type counts as untyped for coverage purposes (null or generic).
     */
    public static boolean isGeneric(String type) {
        return type == null || GENERIC.equals(type);
    }
}
