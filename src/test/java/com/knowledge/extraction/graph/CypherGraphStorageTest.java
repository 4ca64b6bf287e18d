package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CypherGraphStorage Tests")
class CypherGraphStorageTest {

    private StubGraphConnection connection;
    private CypherGraphStorage storage;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        storage = new CypherGraphStorage(connection);
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("Entity upsert merges on the canonical key and links its chunks")
        void upsertEntity() {
            storage.upsertEntity(Entity.builder().id("e1").name(" Acme  Corp").type("ORGANIZATION")
                    .sourceChunkId("c1").sourceChunkId("c2").build());

            String query = connection.executedQueries.get(0);
            Map<String, Object> row = onlyRow(connection.executedParams.get(0));
            assertTrue(query.contains("MERGE (e:Entity {key: row.key})"));
            assertTrue(query.contains("MERGE (c)-[:MENTIONS]->(e)"));
            assertEquals("acme corp", row.get("key"));
            assertEquals("e1", row.get("id"));
            assertEquals(List.of("c1", "c2"), row.get("chunkIds"));
        }

        @Test
        @DisplayName("Untyped relation is written with an empty type")
        void upsertUntypedRelation() {
            storage.upsertRelation(Relationship.builder().sourceEntityRef("Acme").targetEntityRef("Berlin").build());

            Map<String, Object> row = onlyRow(connection.executedParams.get(0));
            assertEquals("", row.get("type"));
            assertEquals("acme", row.get("sourceKey"));
            assertEquals("berlin", row.get("targetKey"));
            assertTrue(connection.executedQueries.get(0).contains("MERGE (s)-[r:RELATES {type: row.type}]->(t)"));
        }

        @Test
        @DisplayName("Invalid relationship types are rejected before writing")
        void invalidType() {
            Relationship bad = Relationship.builder().sourceEntityRef("A").targetEntityRef("B")
                    .type("OWNS}]->(x) DETACH DELETE x //").build();

            assertThrows(IllegalArgumentException.class, () -> storage.upsertRelation(bad));
            assertTrue(connection.executedQueries.isEmpty());
        }

        @Test
        @DisplayName("Backend failures are wrapped in StorageWriteException")
        void wrapsFailures() {
            connection.failure = new IllegalStateException("connection reset");

            StorageWriteException e = assertThrows(StorageWriteException.class,
                    () -> storage.deleteRelation("r1"));
            assertTrue(e.getMessage().contains("deleteRelations"));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Batches")
    class BatchTests {

        @Test
        @DisplayName("Consecutive mutations of one kind are sent as one statement")
        void groupsRuns() {
            storage.applyBatch(List.of(
                    new GraphMutation.UpdateRelationType("r1", "OWNS"),
                    new GraphMutation.UpdateRelationType("r2", "LOCATED_IN"),
                    new GraphMutation.DeleteRelation("r3"),
                    new GraphMutation.DeleteRelation("r4"),
                    new GraphMutation.DeleteEntity("e1")));

            assertEquals(4, connection.executedQueries.size());
            assertTrue(connection.executedQueries.get(0).contains("UNWIND $updates AS u"));
            assertEquals(List.of(Map.of("id", "r1", "type", "OWNS"), Map.of("id", "r2", "type", "LOCATED_IN")),
                    connection.executedParams.get(0).get("updates"));
            assertEquals(List.of("r1", "r2"), connection.executedParams.get(1).get("ids"));
            assertEquals(List.of("r3", "r4"), connection.executedParams.get(2).get("ids"));
            assertTrue(connection.executedQueries.get(3).contains("DETACH DELETE e"));
        }

        @Test
        @DisplayName("Retyped relations are folded into a relation that already has their key")
        void foldsRetypedRelations() {
            storage.applyBatch(List.of(new GraphMutation.UpdateRelationType("r1", "LOCATED_IN")));

            String fold = connection.executedQueries.get(1);
            assertTrue(fold.contains("MATCH (s)-[k:RELATES]->(t)"));
            assertTrue(fold.contains("WHERE keep.id <> r.id"));
            assertTrue(fold.contains("DELETE r"));
            assertEquals(Map.of("ids", List.of("r1")), connection.executedParams.get(1));
        }

        @Test
        @DisplayName("Upserts of one kind share a single UNWIND statement")
        void groupsUpserts() {
            storage.applyBatch(List.of(
                    new GraphMutation.UpsertEntity(Entity.builder().name("A").sourceChunkId("c1").build()),
                    new GraphMutation.UpsertEntity(Entity.builder().name("B").sourceChunkId("c1").build()),
                    new GraphMutation.UpsertEntity(Entity.builder().name("C").sourceChunkId("c1").build()),
                    new GraphMutation.UpsertRelation(Relationship.builder()
                            .sourceEntityRef("A").targetEntityRef("B").type("OWNS").build()),
                    new GraphMutation.UpsertRelation(Relationship.builder()
                            .sourceEntityRef("B").targetEntityRef("C").build())));

            assertEquals(2, connection.executedQueries.size());
            assertTrue(connection.executedQueries.get(0).startsWith("UNWIND $rows AS row"));
            assertEquals(3, ((List<?>) connection.executedParams.get(0).get("rows")).size());
            assertEquals(2, ((List<?>) connection.executedParams.get(1).get("rows")).size());
        }

        @Test
        @DisplayName("An invalid mutation rejects the whole batch before anything is written")
        void validatesBeforeWriting() {
            List<GraphMutation> batch = List.of(
                    new GraphMutation.UpsertEntity(Entity.builder().name("Acme").build()),
                    new GraphMutation.UpsertRelation(Relationship.builder()
                            .sourceEntityRef("Acme").targetEntityRef("Berlin").type("GEHÖRT ZU").build()));

            StorageWriteException e = assertThrows(StorageWriteException.class, () -> storage.applyBatch(batch));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(connection.executedQueries.isEmpty());
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("Relations with an empty or missing type are read with an id cursor")
        void findUntyped() {
            connection.queryResults = q -> List.of(Map.of(
                    "id", "r1", "sourceKey", "acme", "targetKey", "berlin",
                    "description", "Acme is headquartered in Berlin", "confidence", 0.7));

            List<StoredRelation> relations = storage.findUntypedRelations(null, 100);

            assertEquals(1, relations.size());
            assertNull(relations.get(0).type());
            assertEquals(0.7, relations.get(0).confidence());
            assertTrue(connection.queries.get(0).contains("coalesce(r.type, '') = ''"));
            assertEquals(Map.of("afterId", "", "limit", 100), connection.executedParams.get(0));
        }

        @Test
        @DisplayName("Orphan entities carry their incident relation ids")
        void findOrphans() {
            connection.queryResults = q -> List.of(Map.of(
                    "id", "e1", "key", "ghost", "name", "Ghost", "type", "UNKNOWN",
                    "relationIds", List.of("r1", "r2")));

            List<StoredEntity> entities = storage.findEntitiesWithoutMentions("e0", 10);

            assertEquals(List.of("r1", "r2"), entities.get(0).relationIds());
            assertEquals("ghost", entities.get(0).canonicalKey());
        }

        @Test
        @DisplayName("Counts and removed mentions are read from the result row")
        void counts() {
            connection.queryResults = q -> q.contains("removed")
                    ? List.of(Map.of("removed", 4L))
                    : List.of(Map.of("total", 7L));

            assertEquals(7, storage.countEntities());
            assertEquals(7, storage.countRelations());
            assertEquals(4, storage.removeMentions(Set.of("c1")));
            assertEquals(0, storage.removeMentions(Set.of()));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> onlyRow(Map<String, Object> params) {
        List<Map<String, Object>> rows = (List<Map<String, Object>>) params.get("rows");
        assertEquals(1, rows.size());
        return rows.get(0);
    }
}
