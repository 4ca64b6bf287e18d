package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.CanonicalKeys;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Thread-safe in-memory {@link GraphStorage}. Used by tests and by single-process
 * deployments that export the graph elsewhere.
 */
public class InMemoryGraphStorage implements GraphStorage {

    static final String PLACEHOLDER_TYPE = "UNKNOWN";

    // canonicalKey -> entity
    private final Map<String, StoredNode> entities = new HashMap<>();
    // id -> relation, ordered for cursor paging
    private final TreeMap<String, StoredEdge> relations = new TreeMap<>();
    // mergeKey -> relation id
    private final Map<String, String> relationsByMergeKey = new HashMap<>();
    // chunkId -> canonical keys of mentioned entities
    private final Map<String, Set<String>> mentions = new HashMap<>();

    @Override
    public synchronized void upsertEntity(Entity entity) {
        StoredNode node = entities.get(entity.getCanonicalKey());
        if (node == null) {
            node = new StoredNode(entity.getId() != null ? entity.getId() : UUID.randomUUID().toString(),
                    entity.getCanonicalKey(), entity.getName(), entity.getType());
            node.description = entity.getDescription();
            node.confidence = entity.getConfidence();
            entities.put(node.key, node);
        } else {
            if (node.placeholder) {
                node.name = entity.getName();
                node.type = entity.getType();
                node.placeholder = false;
            }
            if (node.description.isBlank()) {
                node.description = entity.getDescription();
            }
            node.confidence = Math.max(node.confidence, entity.getConfidence());
        }
        for (String chunkId : entity.getSourceChunkIds()) {
            mentions.computeIfAbsent(chunkId, k -> new LinkedHashSet<>()).add(node.key);
        }
    }

    @Override
    public synchronized void upsertRelation(Relationship relationship) {
        StoredNode source = endpoint(relationship.getSourceEntityRef());
        StoredNode target = endpoint(relationship.getTargetEntityRef());
        String mergeKey = relationship.getMergeKey();
        String existingId = relationsByMergeKey.get(mergeKey);
        if (existingId == null) {
            String id = relationship.getId() != null ? relationship.getId() : UUID.randomUUID().toString();
            StoredEdge edge = new StoredEdge(id, source.key, target.key);
            edge.type = relationship.getType();
            edge.description = relationship.getDescription();
            edge.confidence = relationship.getConfidence();
            relations.put(id, edge);
            relationsByMergeKey.put(mergeKey, id);
        } else {
            StoredEdge edge = relations.get(existingId);
            if (relationship.getDescription().length() > edge.description.length()) {
                edge.description = relationship.getDescription();
            }
            edge.confidence = Math.max(edge.confidence, relationship.getConfidence());
        }
    }

    @Override
    public synchronized void deleteRelation(String relationId) {
        StoredEdge edge = relations.remove(relationId);
        if (edge != null) {
            relationsByMergeKey.remove(edge.mergeKey(), relationId);
        }
    }

    @Override
    public synchronized void deleteEntity(String entityId) {
        findNodeById(entityId).ifPresent(node -> {
            List<String> incident = relations.values().stream()
                    .filter(e -> e.sourceKey.equals(node.key) || e.targetKey.equals(node.key))
                    .map(e -> e.id)
                    .toList();
            incident.forEach(this::deleteRelation);
            mentions.values().forEach(keys -> keys.remove(node.key));
            entities.remove(node.key);
        });
    }

    @Override
    public synchronized void applyBatch(List<GraphMutation> mutations) {
        for (GraphMutation mutation : mutations) {
            if (mutation instanceof GraphMutation.UpsertEntity m) {
                upsertEntity(m.entity());
            } else if (mutation instanceof GraphMutation.UpsertRelation m) {
                upsertRelation(m.relationship());
            } else if (mutation instanceof GraphMutation.UpdateRelationType m) {
                updateRelationType(m.relationId(), m.type());
            } else if (mutation instanceof GraphMutation.DeleteRelation m) {
                deleteRelation(m.relationId());
            } else if (mutation instanceof GraphMutation.DeleteEntity m) {
                deleteEntity(m.entityId());
            } else {
                throw new IllegalArgumentException("Unsupported mutation: " + mutation);
            }
        }
    }

    @Override
    public synchronized List<StoredRelation> findUntypedRelations(String afterId, int limit) {
        Map<String, StoredEdge> tail = afterId == null ? relations : relations.tailMap(afterId, false);
        return tail.values().stream()
                .filter(e -> e.type == null)
                .limit(limit)
                .map(StoredEdge::toStored)
                .toList();
    }

    @Override
    public synchronized List<StoredEntity> findEntitiesWithoutMentions(String afterId, int limit) {
        Set<String> mentioned = new HashSet<>();
        mentions.values().forEach(mentioned::addAll);
        return entities.values().stream()
                .filter(n -> !mentioned.contains(n.key))
                .filter(n -> afterId == null || n.id.compareTo(afterId) > 0)
                .sorted((a, b) -> a.id.compareTo(b.id))
                .limit(limit)
                .map(n -> new StoredEntity(n.id, n.key, n.name, n.type, incidentRelationIds(n.key), 0))
                .toList();
    }

    @Override
    public synchronized long removeMentions(Collection<String> chunkIds) {
        long removed = 0;
        for (String chunkId : chunkIds) {
            Set<String> keys = mentions.remove(chunkId);
            if (keys != null) {
                removed += keys.size();
            }
        }
        return removed;
    }

    @Override
    public synchronized long countEntities() {
        return entities.size();
    }

    @Override
    public synchronized long countRelations() {
        return relations.size();
    }

    public synchronized Optional<StoredEntity> findEntityByKey(String name) {
        StoredNode node = entities.get(CanonicalKeys.entityKey(name));
        if (node == null) {
            return Optional.empty();
        }
        return Optional.of(new StoredEntity(node.id, node.key, node.name, node.type,
                incidentRelationIds(node.key), mentionCount(node.key)));
    }

    public synchronized List<StoredRelation> allRelations() {
        return relations.values().stream().map(StoredEdge::toStored).toList();
    }

    private void updateRelationType(String relationId, String type) {
        StoredEdge edge = relations.get(relationId);
        if (edge == null) {
            return;
        }
        relationsByMergeKey.remove(edge.mergeKey(), relationId);
        edge.type = type;
        String existingId = relationsByMergeKey.putIfAbsent(edge.mergeKey(), relationId);
        if (existingId != null) {
            // fold into the relation that already holds the key
            StoredEdge existing = relations.get(existingId);
            if (edge.description.length() > existing.description.length()) {
                existing.description = edge.description;
            }
            existing.confidence = Math.max(existing.confidence, edge.confidence);
            relations.remove(relationId);
        }
    }

    private StoredNode endpoint(String name) {
        String key = CanonicalKeys.entityKey(name);
        return entities.computeIfAbsent(key, k -> {
            StoredNode node = new StoredNode(UUID.randomUUID().toString(), k, name, PLACEHOLDER_TYPE);
            node.placeholder = true;
            return node;
        });
    }

    private Optional<StoredNode> findNodeById(String id) {
        return entities.values().stream().filter(n -> n.id.equals(id)).findFirst();
    }

    private List<String> incidentRelationIds(String key) {
        List<String> ids = new ArrayList<>();
        for (StoredEdge edge : relations.values()) {
            if (edge.sourceKey.equals(key) || edge.targetKey.equals(key)) {
                ids.add(edge.id);
            }
        }
        return ids;
    }

    private int mentionCount(String key) {
        return (int) mentions.values().stream().filter(keys -> keys.contains(key)).count();
    }

    private static final class StoredNode {
        final String id;
        final String key;
        String name;
        String type;
        String description = "";
        double confidence;
        boolean placeholder;

        StoredNode(String id, String key, String name, String type) {
            this.id = id;
            this.key = key;
            this.name = name;
            this.type = type;
        }
    }

    private static final class StoredEdge {
        final String id;
        final String sourceKey;
        final String targetKey;
        String type;
        String description = "";
        double confidence;

        StoredEdge(String id, String sourceKey, String targetKey) {
            this.id = id;
            this.sourceKey = sourceKey;
            this.targetKey = targetKey;
        }

        String mergeKey() {
            return CanonicalKeys.relationKey(sourceKey, targetKey, type);
        }

        StoredRelation toStored() {
            return new StoredRelation(id, sourceKey, targetKey, type, description, confidence);
        }
    }
}
