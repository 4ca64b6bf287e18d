package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.Objects;

/**
 * A single write applied through {@link GraphStorage#applyBatch}.
 */
public interface GraphMutation {

    /**
     * Creates the entity or merges it into the stored one with the same canonical key,
     * linking it to its source chunks.
     */
    record UpsertEntity(Entity entity) implements GraphMutation {
        public UpsertEntity {
            Objects.requireNonNull(entity, "entity is required");
        }
    }

    /**
     * Creates the relationship or merges it into the stored one with the same merge key.
     * Endpoints missing from the graph are created as placeholder entities.
     */
    record UpsertRelation(Relationship relationship) implements GraphMutation {
        public UpsertRelation {
            Objects.requireNonNull(relationship, "relationship is required");
        }
    }

    record UpdateRelationType(String relationId, String type) implements GraphMutation {
        public UpdateRelationType {
            Objects.requireNonNull(relationId, "relationId is required");
            Objects.requireNonNull(type, "type is required");
        }
    }

    record DeleteRelation(String relationId) implements GraphMutation {
        public DeleteRelation {
            Objects.requireNonNull(relationId, "relationId is required");
        }
    }

    record DeleteEntity(String entityId) implements GraphMutation {
        public DeleteEntity {
            Objects.requireNonNull(entityId, "entityId is required");
        }
    }
}
