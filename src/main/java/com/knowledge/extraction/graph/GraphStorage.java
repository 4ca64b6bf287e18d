package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Persistence of the knowledge graph.
 *
 * <p>Upserts have MERGE semantics: applying the same input twice leaves the graph
 * unchanged. Implementations wrap backend failures in {@link StorageWriteException}.</p>
 */
public interface GraphStorage {

    void upsertEntity(Entity entity);

    void upsertRelation(Relationship relationship);

    void deleteRelation(String relationId);

    /**
     * Deletes the entity together with its mention links and incident relationships.
     */
    void deleteEntity(String entityId);

    /**
     * Applies the mutations in order as one unit of work.
     */
    void applyBatch(List<GraphMutation> mutations);

    /**
     * Returns untyped relationships with an id greater than {@code afterId}, ordered by id.
     *
     * @param afterId exclusive lower bound, or null to start from the beginning
     * @param limit   maximum number of relationships to return
     */
    List<StoredRelation> findUntypedRelations(String afterId, int limit);

    /**
     * Returns entities that no chunk mentions, with an id greater than {@code afterId}, ordered by id.
     */
    List<StoredEntity> findEntitiesWithoutMentions(String afterId, int limit);

    /**
     * Returns every entity that no chunk mentions.
     */
    default List<StoredEntity> findEntitiesWithoutMentions() {
        List<StoredEntity> all = new ArrayList<>();
        String afterId = null;
        List<StoredEntity> page;
        do {
            page = findEntitiesWithoutMentions(afterId, 500);
            all.addAll(page);
            if (!page.isEmpty()) {
                afterId = page.get(page.size() - 1).id();
            }
        } while (page.size() == 500);
        return all;
    }

    /**
     * Removes the mention links of the given chunks, e.g. when their document is deleted.
     *
     * @return number of links removed
     */
    long removeMentions(Collection<String> chunkIds);

    long countEntities();

    long countRelations();
}
