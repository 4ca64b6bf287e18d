package com.knowledge.extraction.graph;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphStorage Tests")
class InMemoryGraphStorageTest {

    private InMemoryGraphStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
    }

    private static Entity entity(String name, String type, String chunkId) {
        return Entity.builder().name(name).type(type).sourceChunkId(chunkId).build();
    }

    private static Relationship relation(String id, String source, String target, String type) {
        return Relationship.builder().id(id).sourceEntityRef(source).targetEntityRef(target).type(type).build();
    }

    @Nested
    @DisplayName("Upserts")
    class UpsertTests {

        @Test
        @DisplayName("Upserting the same input twice leaves the graph unchanged")
        void idempotent() {
            Entity acme = entity("Acme", "ORGANIZATION", "c1");
            Relationship located = relation("r1", "Acme", "Berlin", "LOCATED_IN");

            storage.upsertEntity(acme);
            storage.upsertRelation(located);
            List<StoredRelation> before = storage.allRelations();
            storage.upsertEntity(acme);
            storage.upsertRelation(located);

            assertEquals(2, storage.countEntities());
            assertEquals(1, storage.countRelations());
            assertEquals(before, storage.allRelations());
        }

        @Test
        @DisplayName("Missing endpoints become placeholders promoted by a later upsert")
        void placeholderPromotion() {
            storage.upsertRelation(relation("r1", "Acme", "Berlin", "LOCATED_IN"));
            assertEquals(InMemoryGraphStorage.PLACEHOLDER_TYPE, storage.findEntityByKey("Berlin").orElseThrow().type());

            storage.upsertEntity(entity("BERLIN", "LOCATION", "c1"));

            StoredEntity berlin = storage.findEntityByKey("berlin").orElseThrow();
            assertEquals("LOCATION", berlin.type());
            assertEquals("BERLIN", berlin.name());
            assertEquals(List.of("r1"), berlin.relationIds());
            assertEquals(1, berlin.mentionCount());
        }

        @Test
        @DisplayName("A stored entity keeps its first type")
        void firstTypeKept() {
            storage.upsertEntity(entity("Apple", "ORGANIZATION", "c1"));
            storage.upsertEntity(entity("apple", "FOOD", "c2"));

            StoredEntity apple = storage.findEntityByKey("Apple").orElseThrow();
            assertEquals("ORGANIZATION", apple.type());
            assertEquals(2, apple.mentionCount());
        }

        @Test
        @DisplayName("Merged relation keeps the longer description and higher confidence")
        void relationMerge() {
            storage.upsertRelation(Relationship.builder().sourceEntityRef("A").targetEntityRef("B")
                    .type("OWNS").description("long description here").confidence(0.3).build());
            storage.upsertRelation(Relationship.builder().sourceEntityRef("a").targetEntityRef("b")
                    .type("OWNS").description("short").confidence(0.9).build());

            StoredRelation merged = storage.allRelations().get(0);
            assertEquals(1, storage.countRelations());
            assertEquals("long description here", merged.description());
            assertEquals(0.9, merged.confidence());
        }
    }

    @Nested
    @DisplayName("Maintenance queries")
    class QueryTests {

        @Test
        @DisplayName("Untyped relations are paged by id")
        void untypedPaging() {
            storage.upsertRelation(relation("r1", "A", "B", null));
            storage.upsertRelation(relation("r2", "A", "C", "OWNS"));
            storage.upsertRelation(relation("r3", "B", "C", null));
            storage.upsertRelation(relation("r4", "C", "D", null));

            List<StoredRelation> first = storage.findUntypedRelations(null, 2);
            List<StoredRelation> second = storage.findUntypedRelations("r3", 2);

            assertEquals(List.of("r1", "r3"), first.stream().map(StoredRelation::id).toList());
            assertEquals(List.of("r4"), second.stream().map(StoredRelation::id).toList());
            assertNull(first.get(0).type());
        }

        @Test
        @DisplayName("Entities without mentions are those no chunk links to")
        void withoutMentions() {
            storage.upsertEntity(entity("Acme", "ORGANIZATION", "c1"));
            storage.upsertRelation(relation("r1", "Acme", "Ghost", "OWNS"));

            List<StoredEntity> orphans = storage.findEntitiesWithoutMentions();

            assertEquals(1, orphans.size());
            assertEquals("ghost", orphans.get(0).canonicalKey());
            assertEquals(List.of("r1"), orphans.get(0).relationIds());
        }

        @Test
        @DisplayName("Removing mentions exposes entities to pruning")
        void removeMentions() {
            storage.upsertEntity(entity("Acme", "ORGANIZATION", "c1"));
            storage.upsertEntity(entity("Berlin", "LOCATION", "c1"));
            storage.upsertEntity(entity("Berlin", "LOCATION", "c2"));

            assertEquals(2, storage.removeMentions(Set.of("c1")));
            assertEquals(List.of("acme"), storage.findEntitiesWithoutMentions().stream()
                    .map(StoredEntity::canonicalKey).toList());
            assertEquals(0, storage.removeMentions(Set.of("unknown")));
        }
    }

    @Nested
    @DisplayName("Batches and deletes")
    class BatchTests {

        @Test
        @DisplayName("Batch applies mutations in order")
        void applyBatch() {
            storage.upsertRelation(relation("r1", "A", "B", null));
            storage.upsertRelation(relation("r2", "B", "C", null));

            storage.applyBatch(List.of(
                    new GraphMutation.UpdateRelationType("r1", "OWNS"),
                    new GraphMutation.DeleteRelation("r2")));

            assertEquals(1, storage.countRelations());
            assertEquals("OWNS", storage.allRelations().get(0).type());
            assertTrue(storage.findUntypedRelations(null, 10).isEmpty());
        }

        @Test
        @DisplayName("Deleting an entity removes its incident relations")
        void deleteEntity() {
            storage.upsertRelation(relation("r1", "A", "B", "OWNS"));
            storage.upsertRelation(relation("r2", "C", "D", "OWNS"));
            String id = storage.findEntityByKey("A").orElseThrow().id();

            storage.deleteEntity(id);

            assertTrue(storage.findEntityByKey("A").isEmpty());
            assertEquals(List.of("r2"), storage.allRelations().stream().map(StoredRelation::id).toList());
        }

        @Test
        @DisplayName("Deleting unknown ids is a no-op")
        void deleteUnknown() {
            storage.deleteRelation("missing");
            storage.deleteEntity("missing");

            assertEquals(0, storage.countEntities());
        }
    }
}
