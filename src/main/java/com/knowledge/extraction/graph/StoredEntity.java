package com.knowledge.extraction.graph;

import java.util.List;

/**
 * An entity as persisted, with the ids of the relationships touching it.
 *
 * @param id           storage id
 * @param canonicalKey canonical key
 * @param name         display name
 * @param type         entity type
 * @param relationIds  ids of incident relationships
 * @param mentionCount number of chunks linked to the entity
 */
public record StoredEntity(String id, String canonicalKey, String name, String type,
                           List<String> relationIds, int mentionCount) {

    public StoredEntity {
        relationIds = relationIds != null ? List.copyOf(relationIds) : List.of();
    }
}
