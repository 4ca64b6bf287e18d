package com.knowledge.extraction.extract;

import com.knowledge.extraction.core.model.CancellationToken;
import com.knowledge.extraction.core.model.CanonicalKeys;
import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.ModelDescriptor;
import com.knowledge.extraction.core.model.Relationship;
import com.knowledge.extraction.dedup.Deduplicator;
import com.knowledge.extraction.dedup.MergeOutcome;
import com.knowledge.extraction.glean.GleaningConfig;
import com.knowledge.extraction.glean.GleaningController;
import com.knowledge.extraction.glean.GleaningOutcome;
import com.knowledge.extraction.invoke.InvocationResult;
import com.knowledge.extraction.invoke.ModelInvoker;
import com.knowledge.extraction.llm.CompletenessChecker;
import com.knowledge.extraction.llm.FallbackExtractor;
import com.knowledge.extraction.llm.PatternFallbackExtractor;
import com.knowledge.extraction.parse.ExtractedRecord;
import com.knowledge.extraction.parse.ResponseParser;
import com.knowledge.extraction.tracing.NoOpTracingService;
import com.knowledge.extraction.tracing.Span;
import com.knowledge.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Extracts entities and relationships from a single chunk through the ranked
 * model cascade.
 *
 * <p>Each cascade tries the ranked models in rank order. A timeout, a transport
 * error, unparseable output or zero valid records moves on to the next rank; after
 * the last model the deterministic {@link FallbackExtractor} runs as rank 3, so a
 * cascade always terminates. A failed cascade yields empty results, not an error.</p>
 *
 * <p>Instances are stateless between calls and safe to share between chunk workers.</p>
 */
public class ChunkExtractor {
    private static final Logger log = LoggerFactory.getLogger(ChunkExtractor.class);

    public static final int DEFAULT_MAX_ENTITIES_IN_RELATION_PROMPT = 30;
    public static final int DEFAULT_MAX_ENTITIES_PER_CHUNK = 100;
    public static final int DEFAULT_MAX_RELATIONS_PER_CHUNK = 200;
    public static final double DEFAULT_ENTITY_CONFIDENCE = 1.0;
    public static final double DEFAULT_RELATION_CONFIDENCE = 0.5;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_TYPE_CHARACTERS = Pattern.compile("[^A-Z0-9_]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private final ModelInvoker invoker;
    private final ResponseParser parser;
    private final FallbackExtractor fallback;
    private final List<ModelDescriptor> rankedModels;
    private final Deduplicator deduplicator;
    private final TracingService tracingService;
    private final int maxEntitiesInRelationPrompt;
    private final int maxEntitiesPerChunk;
    private final int maxRelationsPerChunk;
    private final GleaningController gleaningController;

    private ChunkExtractor(Builder builder) {
        this.invoker = Objects.requireNonNull(builder.invoker, "invoker is required");
        this.parser = builder.parser != null ? builder.parser : new ResponseParser();
        this.fallback = builder.fallback != null ? builder.fallback : new PatternFallbackExtractor();
        this.rankedModels = sortByRank(builder.rankedModels);
        this.deduplicator = builder.deduplicator != null ? builder.deduplicator : new Deduplicator();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.maxEntitiesInRelationPrompt = builder.maxEntitiesInRelationPrompt;
        this.maxEntitiesPerChunk = builder.maxEntitiesPerChunk;
        this.maxRelationsPerChunk = builder.maxRelationsPerChunk;
        this.gleaningController = new GleaningController(this::extractRelations,
                builder.completenessChecker != null ? builder.completenessChecker : CompletenessChecker.ALWAYS_COMPLETE,
                builder.gleaningConfig != null ? builder.gleaningConfig : GleaningConfig.defaults(),
                maxEntitiesInRelationPrompt);
    }

    /**
     * Runs entity extraction, relation extraction, gleaning and chunk-local
     * deduplication for one chunk.
     *
     * @throws CancellationException if the token is cancelled before a model call
     */
    public ChunkExtractionResult extract(ChunkInput chunk, CancellationToken token) {
        try (Span span = tracingService.startSpan("extraction.chunk", Map.of("chunkId", chunk.chunkId()))) {
            EntityExtraction entities = extractEntities(chunk, rankedModels, token);
            RelationExtraction relations = entities.entities().isEmpty()
                    ? RelationExtraction.skipped()
                    : extractRelations(chunk, entities.entities(), rankedModels, token);
            GleaningOutcome gleaning = gleaningController.glean(chunk, entities.entities(),
                    relations.relations(), token);

            MergeOutcome<Entity> mergedEntities = deduplicator.mergeEntities(entities.entities());
            List<Relationship> relationsToMerge = capRelations(chunk, gleaning.relations());
            MergeOutcome<Relationship> mergedRelations = deduplicator.mergeRelations(relationsToMerge);

            ChunkExtractionResult result = new ChunkExtractionResult(
                    chunk.chunkId(),
                    mergedEntities.merged(),
                    mergedRelations.merged(),
                    mergedEntities.rawCount(),
                    mergedRelations.rawCount(),
                    entities.rankUsed(),
                    relations.rankUsed(),
                    gleaning.rounds(),
                    entities.modelCalls() + relations.modelCalls() + gleaning.modelCalls(),
                    entities.latencyMs() + relations.latencyMs() + gleaning.latencyMs());

            span.setAttribute("entities", result.entities().size());
            span.setAttribute("relations", result.relations().size());
            span.setAttribute("entityRankUsed", result.entityRankUsed());
            span.setAttribute("relationRankUsed", result.relationRankUsed());
            span.setStatus(Span.SpanStatus.OK);
            log.debug("extraction.chunk.extracted chunkId={} entities={} relations={} entityRank={} relationRank={} "
                            + "gleaningRounds={}",
                    chunk.chunkId(), result.entities().size(), result.relations().size(),
                    result.entityRankUsed(), result.relationRankUsed(),
                    result.gleaningRoundsRun());
            return result;
        }
    }

    public ChunkExtractionResult extract(ChunkInput chunk) {
        return extract(chunk, CancellationToken.NONE);
    }

    public EntityExtraction extractEntities(ChunkInput chunk, List<ModelDescriptor> ranked) {
        return extractEntities(chunk, ranked, CancellationToken.NONE);
    }

    public EntityExtraction extractEntities(ChunkInput chunk, List<ModelDescriptor> ranked, CancellationToken token) {
        CascadeResult<Entity> result = runCascade(chunk, sortByRank(ranked), ExtractionPrompts.entityPrompt(chunk.text()),
                records -> toEntities(chunk, records),
                () -> fallback.extractEntities(chunk),
                token, "entities");
        List<Entity> entities = cap(result.items(), maxEntitiesPerChunk, chunk, "entities");
        return new EntityExtraction(entities, result.rank(), result.modelCalls(), result.latencyMs());
    }

    public RelationExtraction extractRelations(ChunkInput chunk, List<Entity> entities, List<ModelDescriptor> ranked) {
        return extractRelations(chunk, entities, ranked, CancellationToken.NONE);
    }

    public RelationExtraction extractRelations(ChunkInput chunk, List<Entity> entities, List<ModelDescriptor> ranked,
                                               CancellationToken token) {
        List<String> names = ExtractionPrompts.distinctNames(entities, maxEntitiesInRelationPrompt);
        return runRelationCascade(chunk, entities, sortByRank(ranked),
                ExtractionPrompts.relationPrompt(chunk.text(), names), token, true);
    }

    /**
     * Runs the relation cascade over the configured models with a continuation prompt.
     * The deterministic fallback is not used here: when no model answers, the round
     * simply finds nothing new.
     */
    RelationExtraction extractRelations(ChunkInput chunk, List<Entity> entities, String prompt,
                                        CancellationToken token) {
        return runRelationCascade(chunk, entities, rankedModels, prompt, token, false);
    }

    private RelationExtraction runRelationCascade(ChunkInput chunk, List<Entity> entities,
                                                  List<ModelDescriptor> ranked, String prompt,
                                                  CancellationToken token, boolean withFallback) {
        Set<String> knownKeys = new HashSet<>();
        entities.forEach(e -> knownKeys.add(e.getCanonicalKey()));
        Supplier<List<Relationship>> fallbackRun = withFallback
                ? () -> withoutSelfLoops(fallback.extractRelations(chunk, entities))
                : null;
        CascadeResult<Relationship> result = runCascade(chunk, ranked, prompt,
                records -> toRelations(chunk, records, knownKeys), fallbackRun, token, "relations");
        return new RelationExtraction(result.items(), result.rank(), result.modelCalls(), result.latencyMs());
    }

    /**
     * @param fallbackRun the rank-3 run, or null to end the cascade empty after the last model
     */
    private <T> CascadeResult<T> runCascade(ChunkInput chunk, List<ModelDescriptor> ranked, String prompt,
                                            Function<List<ExtractedRecord>, List<T>> converter,
                                            Supplier<List<T>> fallbackRun,
                                            CancellationToken token, String kind) {
        String cascadeId = UUID.randomUUID().toString();
        int modelCalls = 0;
        long latencyMs = 0;

        for (ModelDescriptor model : ranked) {
            checkCancelled(token, chunk);
            InvocationResult invocation = invoker.invoke(model, prompt, chunk.chunkId(), cascadeId);
            modelCalls++;
            latencyMs += invocation.latencyMs();
            if (!invocation.isSuccess()) {
                log.debug("cascade.fallthrough chunkId={} kind={} rank={} reason={}",
                        chunk.chunkId(), kind, model.rank(), invocation.outcome());
                continue;
            }
            Optional<List<ExtractedRecord>> records = parser.parse(invocation.text());
            if (records.isEmpty()) {
                log.debug("cascade.fallthrough chunkId={} kind={} rank={} reason=unparseable",
                        chunk.chunkId(), kind, model.rank());
                continue;
            }
            List<T> items = converter.apply(records.get());
            if (items.isEmpty()) {
                log.debug("cascade.fallthrough chunkId={} kind={} rank={} reason=no-valid-records",
                        chunk.chunkId(), kind, model.rank());
                continue;
            }
            return new CascadeResult<>(items, model.rank(), modelCalls, latencyMs);
        }

        if (fallbackRun == null) {
            return new CascadeResult<>(List.of(), 0, modelCalls, latencyMs);
        }
        checkCancelled(token, chunk);
        long start = System.nanoTime();
        List<T> items;
        try {
            items = fallbackRun.get();
        } catch (RuntimeException e) {
            log.error("cascade.fallback.failed chunkId={} kind={} fallback={}",
                    chunk.chunkId(), kind, fallback.getName(), e);
            throw new IllegalStateException("Deterministic fallback " + fallback.getName()
                    + " failed for chunk " + chunk.chunkId(), e);
        }
        long fallbackLatency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        invoker.recordFallbackAttempt(fallback.getName(), fallbackLatency, chunk.chunkId(), cascadeId);
        log.info("cascade.fallback chunkId={} kind={} items={}", chunk.chunkId(), kind, items.size());
        return new CascadeResult<>(items, ModelDescriptor.FALLBACK_RANK, modelCalls, latencyMs + fallbackLatency);
    }

    private List<Entity> toEntities(ChunkInput chunk, List<ExtractedRecord> records) {
        List<Entity> entities = new ArrayList<>();
        for (ExtractedRecord record : records) {
            Optional<String> name = record.text("name", "entity", "entity_name");
            if (name.isEmpty()) {
                continue;
            }
            entities.add(Entity.builder()
                    .name(name.get())
                    .type(normalizeType(record.text("type", "entity_type").orElse(null)))
                    .description(record.text("description").orElse(""))
                    .confidence(confidence(record.number("confidence", "score"), DEFAULT_ENTITY_CONFIDENCE))
                    .sourceChunkId(chunk.chunkId())
                    .build());
        }
        return entities;
    }

    private List<Relationship> toRelations(ChunkInput chunk, List<ExtractedRecord> records, Set<String> knownKeys) {
        List<Relationship> relations = new ArrayList<>();
        for (ExtractedRecord record : records) {
            Optional<String> source = record.text("source", "source_entity", "from", "subject");
            Optional<String> target = record.text("target", "target_entity", "to", "object");
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            String sourceKey = CanonicalKeys.entityKey(source.get());
            String targetKey = CanonicalKeys.entityKey(target.get());
            if (sourceKey.equals(targetKey)) {
                log.debug("extraction.relation.self_loop chunkId={} entity={}", chunk.chunkId(), source.get());
                continue;
            }
            boolean unresolved = !knownKeys.contains(sourceKey) || !knownKeys.contains(targetKey);
            if (unresolved) {
                log.warn("extraction.relation.unresolved chunkId={} source={} target={}",
                        chunk.chunkId(), source.get(), target.get());
            }
            relations.add(Relationship.builder()
                    .sourceEntityRef(source.get())
                    .targetEntityRef(target.get())
                    .type(normalizeType(record.text("type", "relation", "relationship_type", "label").orElse(null)))
                    .description(record.text("description", "evidence").orElse(""))
                    .confidence(confidence(record.number("confidence", "strength", "score"), DEFAULT_RELATION_CONFIDENCE))
                    .sourceChunkId(chunk.chunkId())
                    .unresolvedReference(unresolved)
                    .build());
        }
        return relations;
    }

    private List<Relationship> withoutSelfLoops(List<Relationship> relations) {
        return relations.stream()
                .filter(r -> !CanonicalKeys.entityKey(r.getSourceEntityRef())
                        .equals(CanonicalKeys.entityKey(r.getTargetEntityRef())))
                .toList();
    }

    private List<Relationship> capRelations(ChunkInput chunk, List<Relationship> relations) {
        return cap(relations, maxRelationsPerChunk, chunk, "relations");
    }

    private static <T> List<T> cap(List<T> items, int max, ChunkInput chunk, String kind) {
        if (items.size() <= max) {
            return items;
        }
        log.warn("extraction.cap.exceeded chunkId={} kind={} found={} kept={}",
                chunk.chunkId(), kind, items.size(), max);
        return List.copyOf(items.subList(0, max));
    }

    private static void checkCancelled(CancellationToken token, ChunkInput chunk) {
        if (token.isCancelled()) {
            throw new CancellationException("Extraction cancelled for chunk " + chunk.chunkId());
        }
    }

    /**
     * Maps a model-supplied type onto upper snake case over {@code [A-Z0-9_]}: accents are
     * folded and every other run of characters becomes one underscore.
     *
     * @return the normalized type, or null when nothing storable is left
     */
    static String normalizeType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(type, Normalizer.Form.NFD)).replaceAll("");
        String normalized = NON_TYPE_CHARACTERS.matcher(folded.toUpperCase(Locale.ROOT)).replaceAll("_");
        normalized = EDGE_UNDERSCORES.matcher(normalized).replaceAll("");
        return normalized.isEmpty() ? null : normalized;
    }

    private static double confidence(OptionalDouble value, double defaultValue) {
        if (value.isEmpty() || Double.isNaN(value.getAsDouble())) {
            return defaultValue;
        }
        return Math.max(0.0, Math.min(1.0, value.getAsDouble()));
    }

    private static List<ModelDescriptor> sortByRank(List<ModelDescriptor> models) {
        Objects.requireNonNull(models, "rankedModels is required");
        return models.stream().sorted(Comparator.comparingInt(ModelDescriptor::rank)).toList();
    }

    public List<ModelDescriptor> getRankedModels() {
        return rankedModels;
    }

    public ModelInvoker getInvoker() {
        return invoker;
    }

    private record CascadeResult<T>(List<T> items, int rank, int modelCalls, long latencyMs) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ModelInvoker invoker;
        private ResponseParser parser;
        private FallbackExtractor fallback;
        private List<ModelDescriptor> rankedModels = List.of();
        private Deduplicator deduplicator;
        private TracingService tracingService;
        private CompletenessChecker completenessChecker;
        private GleaningConfig gleaningConfig;
        private int maxEntitiesInRelationPrompt = DEFAULT_MAX_ENTITIES_IN_RELATION_PROMPT;
        private int maxEntitiesPerChunk = DEFAULT_MAX_ENTITIES_PER_CHUNK;
        private int maxRelationsPerChunk = DEFAULT_MAX_RELATIONS_PER_CHUNK;

        public Builder invoker(ModelInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public Builder parser(ResponseParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder fallback(FallbackExtractor fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder rankedModels(List<ModelDescriptor> rankedModels) {
            this.rankedModels = rankedModels;
            return this;
        }

        public Builder deduplicator(Deduplicator deduplicator) {
            this.deduplicator = deduplicator;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder completenessChecker(CompletenessChecker completenessChecker) {
            this.completenessChecker = completenessChecker;
            return this;
        }

        public Builder gleaningConfig(GleaningConfig gleaningConfig) {
            this.gleaningConfig = gleaningConfig;
            return this;
        }

        public Builder maxEntitiesInRelationPrompt(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxEntitiesInRelationPrompt must be > 0");
            }
            this.maxEntitiesInRelationPrompt = max;
            return this;
        }

        public Builder maxEntitiesPerChunk(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxEntitiesPerChunk must be > 0");
            }
            this.maxEntitiesPerChunk = max;
            return this;
        }

        public Builder maxRelationsPerChunk(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxRelationsPerChunk must be > 0");
            }
            this.maxRelationsPerChunk = max;
            return this;
        }

        public ChunkExtractor build() {
            return new ChunkExtractor(this);
        }
    }
}
