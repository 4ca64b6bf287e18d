package com.knowledge.extraction.pipeline;

import com.knowledge.extraction.core.model.CancellationToken;
import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.dedup.Deduplicator;
import com.knowledge.extraction.extract.ChunkExtractionResult;
import com.knowledge.extraction.extract.ChunkExtractor;
import com.knowledge.extraction.graph.GraphMutation;
import com.knowledge.extraction.graph.GraphStorage;
import com.knowledge.extraction.graph.InMemoryGraphStorage;
import com.knowledge.extraction.invoke.CascadeAttemptListener;
import com.knowledge.extraction.invoke.ModelInvoker;
import com.knowledge.extraction.lock.DistributedLock;
import com.knowledge.extraction.lock.NoOpDistributedLock;
import com.knowledge.extraction.logging.LogContext;
import com.knowledge.extraction.metrics.MetricsAggregator;
import com.knowledge.extraction.metrics.MetricsService;
import com.knowledge.extraction.metrics.NoOpMetricsService;
import com.knowledge.extraction.quality.CascadeHealthMonitor;
import com.knowledge.extraction.quality.QualityGate;
import com.knowledge.extraction.quality.ThresholdViolation;
import com.knowledge.extraction.tracing.NoOpTracingService;
import com.knowledge.extraction.tracing.Span;
import com.knowledge.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs chunk extraction for whole documents and writes the results to graph storage.
 *
 * <p>Chunks of a document are extracted on a fixed worker pool with at most
 * {@code maxWorkers} in flight. The calling thread merges the results strictly in
 * chunk order into a {@link DocumentAccumulator}, which applies the quality gate
 * after every chunk. A {@link ThresholdViolation} cancels the document: in-flight
 * chunks are cancelled, nothing else is submitted and the violation is rethrown.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (ExtractionPipeline pipeline = ExtractionPipeline.builder()
 *         .extractor(extractor)
 *         .storage(new CypherGraphStorage(connection))
 *         .build()) {
 *     DocumentExtractionResult result = pipeline.processDocument("doc-1", chunks);
 * }
 * </pre>
 */
public class ExtractionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final ChunkExtractor extractor;
    private final GraphStorage storage;
    private final DistributedLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final QualityGate qualityGate;
    private final BatchProgressTracker progressTracker;
    private final PipelineOptions options;
    private final Deduplicator deduplicator;
    private final MetricsAggregator aggregator;
    private final ExecutorService chunkExecutor;
    private final ExecutorService documentExecutor;
    private final List<CascadeAttemptListener> registeredListeners = new ArrayList<>();

    private ExtractionPipeline(Builder builder) {
        this.extractor = Objects.requireNonNull(builder.extractor, "extractor is required");
        this.storage = builder.storage != null ? builder.storage : new InMemoryGraphStorage();
        this.lock = builder.lock != null ? builder.lock : new NoOpDistributedLock();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.qualityGate = builder.qualityGate != null ? builder.qualityGate : new QualityGate();
        this.progressTracker = builder.progressTracker != null ? builder.progressTracker : new BatchProgressTracker();
        this.options = builder.options != null ? builder.options : PipelineOptions.defaults();
        this.deduplicator = builder.deduplicator != null ? builder.deduplicator : new Deduplicator();
        this.aggregator = new MetricsAggregator();
        this.chunkExecutor = Executors.newFixedThreadPool(
                options.getMaxWorkers() * options.getMaxConcurrentDocuments());
        this.documentExecutor = Executors.newFixedThreadPool(options.getMaxConcurrentDocuments());

        ModelInvoker invoker = extractor.getInvoker();
        CascadeAttemptListener metricsListener = metricsService::recordCascadeAttempt;
        invoker.addListener(metricsListener);
        registeredListeners.add(metricsListener);
        if (builder.healthMonitor != null) {
            builder.healthMonitor.addListener(alert -> metricsService.recordCascadeAlert());
            invoker.addListener(builder.healthMonitor);
            registeredListeners.add(builder.healthMonitor);
        }
    }

    /**
     * Extracts, deduplicates and persists one document.
     *
     * @throws ThresholdViolation if the document fails the quality gate; nothing is persisted
     * @throws com.knowledge.extraction.graph.StorageWriteException if persisting fails
     */
    public DocumentExtractionResult processDocument(String documentId, List<ChunkInput> chunks) {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(chunks, "chunks is required");

        CancellationToken token = new CancellationToken();
        DocumentAccumulator accumulator = new DocumentAccumulator(documentId, aggregator, qualityGate);
        Deque<Future<ChunkExtractionResult>> inFlight = new ArrayDeque<>();
        long start = System.nanoTime();

        progressTracker.startBatch(documentId, chunks.size());
        try (LogContext ctx = LogContext.forDocument(documentId);
             Span span = tracingService.startSpan("extraction.document",
                     Map.of("documentId", documentId, "chunks", String.valueOf(chunks.size())))) {
            log.info("extraction.document.starting documentId={} chunks={} maxWorkers={}",
                    documentId, chunks.size(), options.getMaxWorkers());
            try {
                int next = 0;
                while (next < chunks.size() || !inFlight.isEmpty()) {
                    while (next < chunks.size() && inFlight.size() < options.getMaxWorkers()) {
                        ChunkInput chunk = chunks.get(next++);
                        inFlight.addLast(chunkExecutor.submit(() -> extractChunk(documentId, chunk, token)));
                    }
                    accumulator.add(await(inFlight.removeFirst()));
                    progressTracker.chunkCompleted(documentId);
                }
            } catch (ThresholdViolation e) {
                abort(token, inFlight);
                metricsService.recordThresholdViolation(e.getThresholdName());
                metricsService.recordDocument("aborted", accumulator.getRunningMetrics());
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("extraction.document.aborted documentId={} threshold={} required={} observed={}",
                        documentId, e.getThresholdName(), e.getThreshold(), e.getObserved());
                throw e;
            } catch (RuntimeException e) {
                abort(token, inFlight);
                metricsService.recordDocument("failed", accumulator.getRunningMetrics());
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("extraction.document.failed documentId={} error={}", documentId, e.getMessage(), e);
                throw e;
            }

            DocumentExtractionResult result = accumulator.finish(deduplicator);
            if (options.isPersistResults()) {
                try {
                    persist(result);
                } catch (RuntimeException e) {
                    metricsService.recordDocument("failed", result.metrics());
                    span.recordException(e);
                    span.setStatus(Span.SpanStatus.ERROR);
                    log.error("extraction.document.persist_failed documentId={} error={}",
                            documentId, e.getMessage(), e);
                    throw e;
                }
            }
            metricsService.recordDocument("completed", result.metrics());
            span.setAttribute("entities", result.entities().size());
            span.setAttribute("relations", result.relations().size());
            span.setAttribute("relationRatio", result.metrics().relationRatio());
            span.setStatus(Span.SpanStatus.OK);
            log.info("extraction.document.completed documentId={} metrics={} durationMs={}",
                    documentId, result.metrics(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return result;
        } finally {
            qualityGate.endDocument(documentId);
            progressTracker.removeBatch(documentId);
        }
    }

    /**
     * Processes several documents concurrently, up to {@code maxConcurrentDocuments}
     * at a time. A failing document does not affect the others.
     */
    public BatchExtractionResult processDocuments(Map<String, List<ChunkInput>> documents) {
        Objects.requireNonNull(documents, "documents is required");
        Map<String, CompletableFuture<DocumentExtractionResult>> futures = new LinkedHashMap<>();
        documents.forEach((documentId, chunks) -> futures.put(documentId,
                CompletableFuture.supplyAsync(() -> processDocument(documentId, chunks), documentExecutor)));

        Map<String, DocumentExtractionResult> results = new LinkedHashMap<>();
        Map<String, RuntimeException> failures = new LinkedHashMap<>();
        futures.forEach((documentId, future) -> {
            try {
                results.put(documentId, future.join());
            } catch (CompletionException e) {
                failures.put(documentId, e.getCause() instanceof RuntimeException re ? re : e);
            } catch (CancellationException e) {
                failures.put(documentId, e);
            }
        });
        log.info("extraction.batch.completed documents={} succeeded={} failed={}",
                documents.size(), results.size(), failures.size());
        return new BatchExtractionResult(results, failures);
    }

    public BatchProgressTracker getProgressTracker() {
        return progressTracker;
    }

    private ChunkExtractionResult extractChunk(String documentId, ChunkInput chunk, CancellationToken token) {
        try (LogContext ctx = LogContext.forChunk(documentId, chunk.chunkId())) {
            ChunkExtractionResult result = extractor.extract(chunk, token);
            metricsService.recordGleaningRounds(result.gleaningRoundsRun());
            log.info("extraction.chunk.completed chunkId={} entities={} relations={} entityRank={} relationRank={} "
                            + "modelCalls={}",
                    chunk.chunkId(), result.entities().size(), result.relations().size(),
                    result.entityRankUsed(), result.relationRankUsed(), result.modelCalls());
            return result;
        }
    }

    private static ChunkExtractionResult await(Future<ChunkExtractionResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Chunk extraction failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for chunk extraction");
        }
    }

    private static void abort(CancellationToken token, Deque<Future<ChunkExtractionResult>> inFlight) {
        token.cancel();
        for (Future<ChunkExtractionResult> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
    }

    private void persist(DocumentExtractionResult result) {
        List<GraphMutation> mutations = new ArrayList<>(result.entities().size() + result.relations().size());
        result.entities().forEach(e -> mutations.add(new GraphMutation.UpsertEntity(e)));
        result.relations().forEach(r -> mutations.add(new GraphMutation.UpsertRelation(r)));

        int batchSize = options.getUpsertBatchSize();
        lock.withLock(options.getLockKey(), () -> {
            for (int start = 0; start < mutations.size(); start += batchSize) {
                storage.applyBatch(mutations.subList(start, Math.min(start + batchSize, mutations.size())));
            }
            return null;
        });
        log.debug("extraction.document.persisted documentId={} mutations={} batchSize={}",
                result.documentId(), mutations.size(), batchSize);
    }

    @Override
    public void close() {
        ModelInvoker invoker = extractor.getInvoker();
        registeredListeners.forEach(invoker::removeListener);
        registeredListeners.clear();
        shutdown(documentExecutor);
        shutdown(chunkExecutor);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ChunkExtractor extractor;
        private GraphStorage storage;
        private DistributedLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private QualityGate qualityGate;
        private CascadeHealthMonitor healthMonitor;
        private BatchProgressTracker progressTracker;
        private PipelineOptions options;
        private Deduplicator deduplicator;

        public Builder extractor(ChunkExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder storage(GraphStorage storage) {
            this.storage = storage;
            return this;
        }

        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder qualityGate(QualityGate qualityGate) {
            this.qualityGate = qualityGate;
            return this;
        }

        public Builder healthMonitor(CascadeHealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public Builder progressTracker(BatchProgressTracker progressTracker) {
            this.progressTracker = progressTracker;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder deduplicator(Deduplicator deduplicator) {
            this.deduplicator = deduplicator;
            return this;
        }

        public ExtractionPipeline build() {
            return new ExtractionPipeline(this);
        }
    }
}
