package com.knowledge.extraction.graph;

/**
 * A relationship as persisted.
 *
 * @param id          storage id, used as the maintenance cursor
 * @param sourceKey   canonical key of the source entity
 * @param targetKey   canonical key of the target entity
 * @param type        relationship type, null if untyped
 * @param description evidence text
 * @param confidence  confidence 0..1
 */
public record StoredRelation(String id, String sourceKey, String targetKey, String type,
                             String description, double confidence) {

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
