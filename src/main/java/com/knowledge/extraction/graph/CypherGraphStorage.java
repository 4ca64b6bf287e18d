package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.CanonicalKeys;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link GraphStorage} over a Cypher {@link GraphConnection}.
 *
 * <p>Graph layout: {@code (:Entity {key, id, name, type, description, confidence, placeholder})},
 * {@code (:Chunk {id})-[:MENTIONS]->(:Entity)} and
 * {@code (:Entity)-[:RELATES {id, type, description, confidence}]->(:Entity)}.
 * An untyped relationship is stored with {@code type = ''} so that it can take part
 * in a MERGE pattern.</p>
 */
public class CypherGraphStorage implements GraphStorage {
    private static final Logger log = LoggerFactory.getLogger(CypherGraphStorage.class);

    private static final String UNTYPED = "";

    private static final String UPSERT_ENTITIES = """
            UNWIND $rows AS row
            MERGE (e:Entity {key: row.key})
            ON CREATE SET e.id = row.id, e.name = row.name, e.type = row.type, e.description = row.description,
                e.confidence = row.confidence, e.placeholder = false
            ON MATCH SET e.name = CASE WHEN e.placeholder THEN row.name ELSE e.name END,
                e.type = CASE WHEN e.placeholder THEN row.type ELSE e.type END,
                e.description = CASE WHEN e.description = '' THEN row.description ELSE e.description END,
                e.confidence = CASE WHEN e.confidence < row.confidence THEN row.confidence ELSE e.confidence END,
                e.placeholder = false
            WITH e, row
            UNWIND row.chunkIds AS chunkId
            MERGE (c:Chunk {id: chunkId})
            MERGE (c)-[:MENTIONS]->(e)
            """;

    private static final String UPSERT_RELATIONS = """
            UNWIND $rows AS row
            MERGE (s:Entity {key: row.sourceKey})
            ON CREATE SET s.id = row.sourceId, s.name = row.sourceName, s.type = 'UNKNOWN', s.description = '',
                s.confidence = 0.0, s.placeholder = true
            MERGE (t:Entity {key: row.targetKey})
            ON CREATE SET t.id = row.targetId, t.name = row.targetName, t.type = 'UNKNOWN', t.description = '',
                t.confidence = 0.0, t.placeholder = true
            MERGE (s)-[r:RELATES {type: row.type}]->(t)
            ON CREATE SET r.id = row.id, r.description = row.description, r.confidence = row.confidence
            ON MATCH SET r.description = CASE WHEN size(r.description) < size(row.description)
                    THEN row.description ELSE r.description END,
                r.confidence = CASE WHEN r.confidence < row.confidence THEN row.confidence ELSE r.confidence END
            """;

    private static final String UPDATE_RELATION_TYPES = """
            UNWIND $updates AS u
            MATCH ()-[r:RELATES]->()
            WHERE r.id = u.id
            SET r.type = u.type
            """;

    // Retyped relations that now share (source, target, type) with another relation are folded
    // into one survivor: a relation that was not retyped if there is one, else the lowest id.
    private static final String FOLD_RETYPED_RELATIONS = """
            MATCH (s:Entity)-[r:RELATES]->(t:Entity)
            WHERE r.id IN $ids
            MATCH (s)-[k:RELATES]->(t)
            WHERE k.type = r.type
            WITH r, k ORDER BY CASE WHEN k.id IN $ids THEN 1 ELSE 0 END, k.id
            WITH r, collect(k)[0] AS keep
            WHERE keep.id <> r.id
            SET keep.confidence = CASE WHEN keep.confidence < r.confidence THEN r.confidence ELSE keep.confidence END,
                keep.description = CASE WHEN size(coalesce(keep.description, '')) < size(coalesce(r.description, ''))
                    THEN r.description ELSE keep.description END
            DELETE r
            """;

    private final GraphConnection connection;

    public CypherGraphStorage(GraphConnection connection) {
        this.connection = connection;
    }

    /**
     * @throws IllegalArgumentException if the entity name is invalid; nothing is written
     */
    @Override
    public void upsertEntity(Entity entity) {
        write("upsertEntities", UPSERT_ENTITIES, Map.of("rows", List.of(entityRow(entity))));
    }

    /**
     * @throws IllegalArgumentException if an endpoint name or the type is invalid; nothing is written
     */
    @Override
    public void upsertRelation(Relationship relationship) {
        write("upsertRelations", UPSERT_RELATIONS, Map.of("rows", List.of(relationRow(relationship))));
    }

    @Override
    public void deleteRelation(String relationId) {
        deleteRelations(List.of(relationId));
    }

    @Override
    public void deleteEntity(String entityId) {
        deleteEntities(List.of(entityId));
    }

    /**
     * Applies the mutations in order. Every mutation is validated before the first
     * statement is sent, then each run of consecutive mutations of one kind is sent
     * as a single UNWIND / IN statement.
     *
     * @throws StorageWriteException if a mutation is invalid or the backend fails
     */
    @Override
    public void applyBatch(List<GraphMutation> mutations) {
        List<Statement> statements = new ArrayList<>();
        try {
            int i = 0;
            while (i < mutations.size()) {
                GraphMutation mutation = mutations.get(i);
                int end = i + 1;
                while (end < mutations.size() && mutations.get(end).getClass() == mutation.getClass()) {
                    end++;
                }
                statements.addAll(statementsFor(mutation, mutations.subList(i, end)));
                i = end;
            }
        } catch (IllegalArgumentException e) {
            throw new StorageWriteException("Graph batch rejected before writing: " + e.getMessage(), e);
        }
        for (Statement statement : statements) {
            write(statement.operation(), statement.query(), statement.params());
        }
        log.debug("graph.batch.applied mutations={} statements={}", mutations.size(), statements.size());
    }

    private List<Statement> statementsFor(GraphMutation first, List<GraphMutation> run) {
        if (first instanceof GraphMutation.UpsertEntity) {
            List<Map<String, Object>> rows = run.stream()
                    .map(m -> entityRow(((GraphMutation.UpsertEntity) m).entity())).toList();
            return List.of(new Statement("upsertEntities", UPSERT_ENTITIES, Map.of("rows", rows)));
        }
        if (first instanceof GraphMutation.UpsertRelation) {
            List<Map<String, Object>> rows = run.stream()
                    .map(m -> relationRow(((GraphMutation.UpsertRelation) m).relationship())).toList();
            return List.of(new Statement("upsertRelations", UPSERT_RELATIONS, Map.of("rows", rows)));
        }
        if (first instanceof GraphMutation.UpdateRelationType) {
            return updateRelationTypes(run.stream().map(GraphMutation.UpdateRelationType.class::cast).toList());
        }
        if (first instanceof GraphMutation.DeleteRelation) {
            List<String> ids = run.stream().map(m -> ((GraphMutation.DeleteRelation) m).relationId()).toList();
            return List.of(deleteRelationsStatement(ids));
        }
        if (first instanceof GraphMutation.DeleteEntity) {
            List<String> ids = run.stream().map(m -> ((GraphMutation.DeleteEntity) m).entityId()).toList();
            return List.of(deleteEntitiesStatement(ids));
        }
        throw new IllegalArgumentException("Unsupported mutation: " + first);
    }

    @Override
    public List<StoredRelation> findUntypedRelations(String afterId, int limit) {
        String query = """
                MATCH (s:Entity)-[r:RELATES]->(t:Entity)
                WHERE coalesce(r.type, '') = '' AND r.id > $afterId
                RETURN r.id AS id, s.key AS sourceKey, t.key AS targetKey,
                       r.description AS description, r.confidence AS confidence
                ORDER BY r.id
                LIMIT $limit
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "afterId", afterId != null ? afterId : "",
                "limit", limit));
        return rows.stream().map(this::toStoredRelation).toList();
    }

    @Override
    public List<StoredEntity> findEntitiesWithoutMentions(String afterId, int limit) {
        String query = """
                MATCH (e:Entity)
                WHERE e.id > $afterId AND NOT (:Chunk)-[:MENTIONS]->(e)
                WITH e ORDER BY e.id LIMIT $limit
                OPTIONAL MATCH (e)-[r:RELATES]-()
                RETURN e.id AS id, e.key AS key, e.name AS name, e.type AS type, collect(r.id) AS relationIds
                ORDER BY id
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "afterId", afterId != null ? afterId : "",
                "limit", limit));
        List<StoredEntity> entities = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            entities.add(new StoredEntity(
                    (String) row.get("id"),
                    (String) row.get("key"),
                    (String) row.get("name"),
                    (String) row.get("type"),
                    toStringList(row.get("relationIds")),
                    0));
        }
        return entities;
    }

    @Override
    public long removeMentions(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return 0;
        }
        String query = """
                MATCH (c:Chunk)-[m:MENTIONS]->()
                WHERE c.id IN $chunkIds
                DELETE m
                RETURN count(m) AS removed
                """;
        long removed = countOf(writeQuery("removeMentions", query, Map.of("chunkIds", List.copyOf(chunkIds))),
                "removed");
        log.info("graph.mentions.removed chunks={} links={}", chunkIds.size(), removed);
        return removed;
    }

    @Override
    public long countEntities() {
        return countOf(connection.query("MATCH (e:Entity) RETURN count(e) AS total"), "total");
    }

    @Override
    public long countRelations() {
        return countOf(connection.query("MATCH ()-[r:RELATES]->() RETURN count(r) AS total"), "total");
    }

    private static Map<String, Object> entityRow(Entity entity) {
        InputSanitizer.validateEntityName(entity.getName());
        Map<String, Object> row = new HashMap<>();
        row.put("key", entity.getCanonicalKey());
        row.put("id", entity.getId() != null ? entity.getId() : UUID.randomUUID().toString());
        row.put("name", entity.getName());
        row.put("type", entity.getType());
        row.put("description", InputSanitizer.truncate(entity.getDescription()));
        row.put("confidence", entity.getConfidence());
        row.put("chunkIds", List.copyOf(entity.getSourceChunkIds()));
        return row;
    }

    private static Map<String, Object> relationRow(Relationship relationship) {
        InputSanitizer.validateEntityName(relationship.getSourceEntityRef());
        InputSanitizer.validateEntityName(relationship.getTargetEntityRef());
        InputSanitizer.validateRelationshipType(relationship.getType());
        Map<String, Object> row = new HashMap<>();
        row.put("sourceKey", CanonicalKeys.entityKey(relationship.getSourceEntityRef()));
        row.put("sourceId", UUID.randomUUID().toString());
        row.put("sourceName", relationship.getSourceEntityRef());
        row.put("targetKey", CanonicalKeys.entityKey(relationship.getTargetEntityRef()));
        row.put("targetId", UUID.randomUUID().toString());
        row.put("targetName", relationship.getTargetEntityRef());
        row.put("type", relationship.getType() != null ? relationship.getType() : UNTYPED);
        row.put("id", relationship.getId() != null ? relationship.getId() : UUID.randomUUID().toString());
        row.put("description", InputSanitizer.truncate(relationship.getDescription()));
        row.put("confidence", relationship.getConfidence());
        return row;
    }

    private static List<Statement> updateRelationTypes(List<GraphMutation.UpdateRelationType> updates) {
        updates.forEach(u -> InputSanitizer.validateRelationshipType(u.type()));
        List<Map<String, Object>> rows = updates.stream()
                .map(u -> Map.<String, Object>of("id", u.relationId(), "type", u.type()))
                .toList();
        List<String> ids = updates.stream().map(GraphMutation.UpdateRelationType::relationId).toList();
        return List.of(
                new Statement("updateRelationTypes", UPDATE_RELATION_TYPES, Map.of("updates", rows)),
                new Statement("foldRetypedRelations", FOLD_RETYPED_RELATIONS, Map.of("ids", ids)));
    }

    private void deleteRelations(List<String> ids) {
        Statement statement = deleteRelationsStatement(ids);
        write(statement.operation(), statement.query(), statement.params());
    }

    private void deleteEntities(List<String> ids) {
        Statement statement = deleteEntitiesStatement(ids);
        write(statement.operation(), statement.query(), statement.params());
    }

    private static Statement deleteRelationsStatement(List<String> ids) {
        String query = """
                MATCH ()-[r:RELATES]->()
                WHERE r.id IN $ids
                DELETE r
                """;
        return new Statement("deleteRelations", query, Map.of("ids", ids));
    }

    private static Statement deleteEntitiesStatement(List<String> ids) {
        String query = """
                MATCH (e:Entity)
                WHERE e.id IN $ids
                DETACH DELETE e
                """;
        return new Statement("deleteEntities", query, Map.of("ids", ids));
    }

    private void write(String operation, String query, Map<String, Object> params) {
        try {
            connection.execute(query, params);
        } catch (RuntimeException e) {
            throw new StorageWriteException("Graph write '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> writeQuery(String operation, String query, Map<String, Object> params) {
        try {
            return connection.query(query, params);
        } catch (RuntimeException e) {
            throw new StorageWriteException("Graph write '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private StoredRelation toStoredRelation(Map<String, Object> row) {
        String type = (String) row.get("type");
        Object confidence = row.get("confidence");
        return new StoredRelation(
                (String) row.get("id"),
                (String) row.get("sourceKey"),
                (String) row.get("targetKey"),
                type == null || type.isEmpty() ? null : type,
                row.get("description") != null ? row.get("description").toString() : "",
                confidence instanceof Number n ? n.doubleValue() : 0.0);
    }

    private static List<String> toStringList(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().filter(v -> v != null).map(Object::toString).toList();
        }
        return List.of();
    }

    private static long countOf(List<Map<String, Object>> rows, String column) {
        if (rows.isEmpty()) {
            return 0;
        }
        Object val = rows.get(0).get(column);
        if (val instanceof Number n) {
            return n.longValue();
        }
        return 0;
    }

    private record Statement(String operation, String query, Map<String, Object> params) {}
}
