package com.knowledge.extraction.pipeline;

import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.ModelDescriptor;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.extract.ChunkExtractor;
import com.knowledge.extraction.glean.GleaningConfig;
import com.knowledge.extraction.graph.CypherGraphStorage;
import com.knowledge.extraction.graph.GraphMutation;
import com.knowledge.extraction.graph.InMemoryGraphStorage;
import com.knowledge.extraction.graph.StoredEntity;
import com.knowledge.extraction.graph.StubGraphConnection;
import com.knowledge.extraction.invoke.ModelInvoker;
import com.knowledge.extraction.llm.ScriptedLLMProvider;
import com.knowledge.extraction.lock.DistributedLock;
import com.knowledge.extraction.lock.LocalDistributedLock;
import com.knowledge.extraction.metrics.MicrometerMetricsService;
import com.knowledge.extraction.quality.QualityGate;
import com.knowledge.extraction.quality.QualityGateConfig;
import com.knowledge.extraction.quality.QualityWarning;
import com.knowledge.extraction.quality.ThresholdViolation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtractionPipeline Tests")
class ExtractionPipelineTest {

    private static final ModelDescriptor MODEL = ModelDescriptor.of("small-model", 1, Duration.ofSeconds(5));

    private static final String ACME_TEXT = "Acme is headquartered in Berlin.";
    private static final String BOB_TEXT = "Bob works for Acme.";
    private static final String EMPTY_TEXT = "nothing happened here.";
    private static final String GAMMA_TEXT = "Gamma Labs opened in Oslo.";

    private static final String ACME_ENTITIES = """
            [{"name": "Acme", "type": "ORGANIZATION", "description": "A company"},
             {"name": "Berlin", "type": "LOCATION", "description": "A city"}]
            """;
    private static final String BOB_ENTITIES = """
            [{"name": "Bob", "type": "PERSON"},
             {"name": "Acme", "type": "ORGANIZATION"}]
            """;
    private static final String ACME_RELATIONS = """
            [{"source": "Acme", "target": "Berlin", "type": "LOCATED_IN",
              "description": "Acme is headquartered in Berlin", "confidence": 0.9}]
            """;
    private static final String BOB_RELATIONS = """
            [{"source": "Bob", "target": "Acme", "type": "WORKS_FOR",
              "description": "Bob works for Acme", "confidence": 0.8}]
            """;

    private ModelInvoker invoker;
    private ExtractionPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        if (invoker != null) {
            invoker.close();
        }
    }

    private static String scripted(String prompt) {
        boolean entityPrompt = prompt.startsWith("Extract the named entities");
        if (prompt.contains(ACME_TEXT)) {
            return entityPrompt ? ACME_ENTITIES : ACME_RELATIONS;
        }
        if (prompt.contains(BOB_TEXT)) {
            return entityPrompt ? BOB_ENTITIES : BOB_RELATIONS;
        }
        return "[]";
    }

    private ChunkExtractor extractor(ScriptedLLMProvider provider) {
        invoker = new ModelInvoker(provider);
        return ChunkExtractor.builder()
                .invoker(invoker)
                .rankedModels(List.of(MODEL))
                .gleaningConfig(GleaningConfig.disabled())
                .build();
    }

    @Nested
    @DisplayName("Single document")
    class SingleDocumentTests {

        @Test
        @DisplayName("Extracts, deduplicates and persists a document")
        void endToEnd() {
            InMemoryGraphStorage storage = new InMemoryGraphStorage();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .storage(storage)
                    .build();

            DocumentExtractionResult result = pipeline.processDocument("doc-1", List.of(
                    new ChunkInput("c1", ACME_TEXT),
                    new ChunkInput("c2", BOB_TEXT)));

            assertEquals(3, result.entities().size());
            assertEquals(2, result.relations().size());
            assertEquals(2, result.metrics().chunksProcessed());
            assertEquals(3, result.metrics().entitiesTotal());
            assertEquals(4, result.metrics().rawEntities());
            assertEquals(2, result.metrics().relationsTotal());
            assertTrue(result.warnings().isEmpty());

            assertEquals(3, storage.countEntities());
            assertEquals(2, storage.countRelations());
            StoredEntity acme = storage.findEntityByKey("acme").orElseThrow();
            assertEquals(2, acme.mentionCount());
            assertEquals(2, acme.relationIds().size());
        }

        @Test
        @DisplayName("Free-form relation types from the model are stored through Cypher")
        void freeFormRelationTypes() {
            String relations = """
                    [{"source": "Acme", "target": "Berlin", "type": "GEHÖRT ZU", "confidence": 0.8},
                     {"source": "Berlin", "target": "Acme", "type": "WORKS_FOR/EMPLOYS", "confidence": 0.6}]
                    """;
            StubGraphConnection connection = new StubGraphConnection();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) ->
                            prompt.startsWith("Extract the named entities") ? ACME_ENTITIES : relations)))
                    .storage(new CypherGraphStorage(connection))
                    .build();

            DocumentExtractionResult result = pipeline.processDocument("doc-1",
                    List.of(new ChunkInput("c1", ACME_TEXT)));

            assertEquals(List.of("GEHORT_ZU", "WORKS_FOR_EMPLOYS"),
                    result.relations().stream().map(Relationship::getType).sorted().toList());
            assertEquals(2, connection.executedQueries.size());
            List<?> relationRows = (List<?>) connection.executedParams.get(1).get("rows");
            assertEquals(2, relationRows.size());
        }

        @Test
        @DisplayName("Persisting the same document twice leaves the graph unchanged")
        void idempotentPersist() {
            InMemoryGraphStorage storage = new InMemoryGraphStorage();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .storage(storage)
                    .build();
            List<ChunkInput> chunks = List.of(new ChunkInput("c1", ACME_TEXT), new ChunkInput("c2", BOB_TEXT));

            pipeline.processDocument("doc-1", chunks);
            pipeline.processDocument("doc-1", chunks);

            assertEquals(3, storage.countEntities());
            assertEquals(2, storage.countRelations());
        }

        @Test
        @DisplayName("Results are not written when persistence is off")
        void noPersist() {
            InMemoryGraphStorage storage = new InMemoryGraphStorage();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .storage(storage)
                    .options(PipelineOptions.builder().persistResults(false).build())
                    .build();

            DocumentExtractionResult result = pipeline.processDocument("doc-1", List.of(new ChunkInput("c1", ACME_TEXT)));

            assertEquals(2, result.entities().size());
            assertEquals(0, storage.countEntities());
        }

        @Test
        @DisplayName("Persists while holding the graph-write lock")
        void persistsUnderLock() {
            LocalDistributedLock lock = new LocalDistributedLock();
            List<Boolean> lockedDuringWrite = new CopyOnWriteArrayList<>();
            InMemoryGraphStorage storage = new InMemoryGraphStorage() {
                @Override
                public synchronized void applyBatch(List<GraphMutation> mutations) {
                    lockedDuringWrite.add(lock.isLocked(DistributedLock.GRAPH_WRITE_KEY));
                    super.applyBatch(mutations);
                }
            };
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .storage(storage)
                    .lock(lock)
                    .options(PipelineOptions.builder().upsertBatchSize(2).build())
                    .build();

            pipeline.processDocument("doc-1", List.of(new ChunkInput("c1", ACME_TEXT)));

            // 2 entities + 1 relation in batches of 2
            assertEquals(List.of(true, true), lockedDuringWrite);
            assertFalse(lock.isLocked(DistributedLock.GRAPH_WRITE_KEY));
        }

        @Test
        @DisplayName("Raises a warning after consecutive zero-relation chunks")
        void zeroRelationWarning() {
            QualityGate gate = new QualityGate(QualityGateConfig.builder()
                    .minEntitiesPerChunk(0.0)
                    .zeroRelationStreakWarning(2)
                    .build());
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .qualityGate(gate)
                    .build();

            DocumentExtractionResult result = pipeline.processDocument("doc-1", List.of(
                    new ChunkInput("c1", ACME_TEXT),
                    new ChunkInput("c2", EMPTY_TEXT),
                    new ChunkInput("c3", "still nothing here.")));

            assertEquals(1, result.warnings().size());
            QualityWarning warning = result.warnings().get(0);
            assertEquals("c3", warning.chunkId());
            assertEquals(QualityWarning.ZERO_RELATION_STREAK, warning.kind());
        }
    }

    @Nested
    @DisplayName("Quality gate")
    class QualityGateTests {

        @Test
        @DisplayName("Aborts the document and never submits the remaining chunks")
        void abortsOnDensityViolation() {
            ScriptedLLMProvider provider = new ScriptedLLMProvider((model, prompt) ->
                    prompt.startsWith("Extract the named entities") && prompt.contains("Alpha rises")
                            ? "[{\"name\": \"Alpha\", \"type\": \"CONCEPT\"}]"
                            : "[]");
            InMemoryGraphStorage storage = new InMemoryGraphStorage();
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(provider))
                    .storage(storage)
                    .metricsService(new MicrometerMetricsService(registry))
                    .qualityGate(new QualityGate(QualityGateConfig.builder().minEntitiesPerChunk(1.0).build()))
                    .options(PipelineOptions.builder().maxWorkers(1).build())
                    .build();

            ThresholdViolation violation = assertThrows(ThresholdViolation.class,
                    () -> pipeline.processDocument("doc-1", List.of(
                            new ChunkInput("c1", "Alpha rises."),
                            new ChunkInput("c2", EMPTY_TEXT),
                            new ChunkInput("c3", GAMMA_TEXT))));

            assertEquals("doc-1", violation.getDocumentId());
            assertEquals(QualityGate.ENTITY_DENSITY, violation.getThresholdName());
            assertEquals(0.5, violation.getObserved(), 1e-9);
            assertEquals(0, provider.countCalls(call -> call.prompt().contains(GAMMA_TEXT)));
            assertEquals(0, storage.countEntities());
            assertEquals(1.0, registry.get("extraction.documents").tag("outcome", "aborted").counter().count());
            assertEquals(1.0, registry.get("extraction.threshold.violations")
                    .tag("threshold", QualityGate.ENTITY_DENSITY).counter().count());
            assertTrue(pipeline.getProgressTracker().activeBatches().isEmpty());
        }
    }

    @Nested
    @DisplayName("Batches and progress")
    class BatchTests {

        @Test
        @DisplayName("A failing document does not affect the others")
        void processDocuments() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();
            Map<String, List<ChunkInput>> documents = new LinkedHashMap<>();
            documents.put("good", List.of(new ChunkInput("g1", ACME_TEXT)));
            documents.put("bad", List.of(new ChunkInput("b1", EMPTY_TEXT)));
            documents.put("also-good", List.of(new ChunkInput("a1", BOB_TEXT)));

            BatchExtractionResult batch = pipeline.processDocuments(documents);

            assertEquals(3, batch.totalDocuments());
            assertFalse(batch.isAllSucceeded());
            assertEquals(List.of("good", "also-good"), List.copyOf(batch.results().keySet()));
            assertInstanceOf(ThresholdViolation.class, batch.failures().get("bad"));
            assertEquals(2.0, registry.get("extraction.documents").tag("outcome", "completed").counter().count());
            assertEquals(1.0, registry.get("extraction.documents").tag("outcome", "aborted").counter().count());
        }

        @Test
        @DisplayName("Reports progress while running and forgets the batch afterwards")
        void progress() {
            BatchProgressTracker tracker = new BatchProgressTracker();
            List<Optional<BatchProgress>> seen = new CopyOnWriteArrayList<>();
            ScriptedLLMProvider provider = new ScriptedLLMProvider((model, prompt) -> {
                if (prompt.startsWith("Extract the named entities") && prompt.contains(BOB_TEXT)) {
                    seen.add(tracker.get("doc-1"));
                }
                return scripted(prompt);
            });
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(provider))
                    .progressTracker(tracker)
                    .options(PipelineOptions.builder().maxWorkers(1).build())
                    .build();

            pipeline.processDocument("doc-1", List.of(new ChunkInput("c1", ACME_TEXT), new ChunkInput("c2", BOB_TEXT)));

            assertEquals(1, seen.size());
            BatchProgress during = seen.get(0).orElseThrow();
            assertEquals(2, during.totalChunks());
            assertEquals(1, during.completedChunks());
            assertEquals(0.5, during.fraction(), 1e-9);
            assertTrue(tracker.activeBatches().isEmpty());
        }

        @Test
        @DisplayName("Cascade attempts are counted by rank and outcome")
        void cascadeMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            pipeline = ExtractionPipeline.builder()
                    .extractor(extractor(new ScriptedLLMProvider((model, prompt) -> scripted(prompt))))
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            pipeline.processDocument("doc-1", List.of(new ChunkInput("c1", ACME_TEXT)));

            assertEquals(2.0, registry.get("extraction.cascade.attempts").tag("rank", "1").counter().count());
        }
    }

    @Nested
    @DisplayName("Options")
    class OptionsTests {

        @Test
        @DisplayName("Default values")
        void defaults() {
            PipelineOptions options = PipelineOptions.defaults();
            assertEquals(4, options.getMaxWorkers());
            assertEquals(2, options.getMaxConcurrentDocuments());
            assertEquals(500, options.getUpsertBatchSize());
            assertTrue(options.isPersistResults());
            assertEquals(DistributedLock.GRAPH_WRITE_KEY, options.getLockKey());
        }

        @Test
        @DisplayName("Rejects invalid values")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().maxWorkers(0));
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().maxConcurrentDocuments(0));
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().upsertBatchSize(0));
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().lockKey(" "));
        }

        @Test
        @DisplayName("Requires an extractor")
        void requiresExtractor() {
            assertThrows(NullPointerException.class, () -> ExtractionPipeline.builder().build());
        }
    }
}
