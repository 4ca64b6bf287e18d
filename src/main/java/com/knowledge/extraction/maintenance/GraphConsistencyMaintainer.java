package com.knowledge.extraction.maintenance;

import com.knowledge.extraction.graph.GraphMutation;
import com.knowledge.extraction.graph.GraphStorage;
import com.knowledge.extraction.graph.StoredEntity;
import com.knowledge.extraction.graph.StoredRelation;
import com.knowledge.extraction.lock.DistributedLock;
import com.knowledge.extraction.lock.NoOpDistributedLock;
import com.knowledge.extraction.logging.LogContext;
import com.knowledge.extraction.metrics.MetricsService;
import com.knowledge.extraction.metrics.NoOpMetricsService;
import com.knowledge.extraction.tracing.NoOpTracingService;
import com.knowledge.extraction.tracing.Span;
import com.knowledge.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Offline repair job for the persisted knowledge graph.
 *
 * <p>A run performs three steps over the whole graph:</p>
 * <ol>
 *   <li>untyped relationships with evidence get a type from {@link RelationTypeInferrer};</li>
 *   <li>untyped relationships without evidence are deleted;</li>
 *   <li>entities left with no relationships and no chunk mentions are deleted.</li>
 * </ol>
 *
 * <p>Writes are committed per batch. A batch that has been committed no longer
 * matches the selection, so re-running after a failure continues where the
 * previous run stopped, and a run right after a successful one changes nothing.
 * The run holds the graph-write lock, which ingestion takes for its upserts too.</p>
 */
public class GraphConsistencyMaintainer {
    private static final Logger log = LoggerFactory.getLogger(GraphConsistencyMaintainer.class);

    private final GraphStorage storage;
    private final RelationTypeInferrer inferrer;
    private final DistributedLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public GraphConsistencyMaintainer(GraphStorage storage) {
        this(storage, new RelationTypeInferrer(), new NoOpDistributedLock(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public GraphConsistencyMaintainer(GraphStorage storage, RelationTypeInferrer inferrer,
                                      DistributedLock lock, MetricsService metricsService,
                                      TracingService tracingService) {
        this.storage = Objects.requireNonNull(storage, "storage is required");
        this.inferrer = Objects.requireNonNull(inferrer, "inferrer is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
    }

    public MaintenanceReport run() {
        return run(MaintenanceOptions.defaults());
    }

    /**
     * Runs the maintenance job.
     *
     * @throws com.knowledge.extraction.lock.LockAcquisitionException if the lock is not granted
     * @throws com.knowledge.extraction.graph.StorageWriteException  if a batch fails to commit;
     *                                                                 earlier batches stay committed
     */
    public MaintenanceReport run(MaintenanceOptions options) {
        Objects.requireNonNull(options, "options is required");
        String runId = UUID.randomUUID().toString();
        try (LogContext ctx = LogContext.forMaintenance(runId, options.dryRun());
             Span span = tracingService.startSpan("maintenance.run",
                     Map.of("runId", runId, "dryRun", Boolean.toString(options.dryRun())))) {
            log.info("maintenance.starting batchSize={} dryRun={}", options.batchSize(), options.dryRun());
            try {
                MaintenanceReport report = lock.withLock(options.lockKey(), () -> execute(options));
                if (!options.dryRun()) {
                    metricsService.recordMaintenanceChanges("typed", report.relationsTyped());
                    metricsService.recordMaintenanceChanges("relation_deleted", report.relationsDeleted());
                    metricsService.recordMaintenanceChanges("entity_deleted", report.entitiesDeleted());
                }
                span.setAttribute("relationsTyped", report.relationsTyped());
                span.setAttribute("relationsDeleted", report.relationsDeleted());
                span.setAttribute("entitiesDeleted", report.entitiesDeleted());
                span.setStatus(Span.SpanStatus.OK);
                log.info("maintenance.completed report={}", report);
                return report;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("maintenance.failed error={}", e.getMessage(), e);
                throw e;
            }
        }
    }

    private MaintenanceReport execute(MaintenanceOptions options) {
        Map<String, Long> inferredTypes = new HashMap<>();
        Set<String> deletedRelationIds = new HashSet<>();
        long typed = repairUntypedRelations(options, inferredTypes, deletedRelationIds);
        long entitiesDeleted = pruneOrphanEntities(options, deletedRelationIds);
        return new MaintenanceReport(typed, deletedRelationIds.size(), entitiesDeleted,
                inferredTypes, options.dryRun());
    }

    /**
     * Steps 1 and 2. Pages are read by id cursor, so committed pages never shift the
     * position of the next one.
     */
    private long repairUntypedRelations(MaintenanceOptions options, Map<String, Long> inferredTypes,
                                        Set<String> deletedRelationIds) {
        long typed = 0;
        String afterId = null;
        List<StoredRelation> page;
        do {
            page = storage.findUntypedRelations(afterId, options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            List<GraphMutation> updates = new ArrayList<>();
            List<GraphMutation> deletions = new ArrayList<>();
            for (StoredRelation relation : page) {
                if (relation.hasDescription()) {
                    String type = inferrer.infer(relation.description());
                    updates.add(new GraphMutation.UpdateRelationType(relation.id(), type));
                    inferredTypes.merge(type, 1L, Long::sum);
                } else {
                    deletions.add(new GraphMutation.DeleteRelation(relation.id()));
                    deletedRelationIds.add(relation.id());
                }
            }
            typed += updates.size();
            afterId = page.get(page.size() - 1).id();

            if (!options.dryRun()) {
                List<GraphMutation> batch = new ArrayList<>(updates);
                batch.addAll(deletions);
                storage.applyBatch(batch);
            }
            log.debug("maintenance.relations.batch typed={} deleted={} cursor={}",
                    updates.size(), deletions.size(), afterId);
        } while (page.size() >= options.batchSize());
        return typed;
    }

    /**
     * Step 3. An entity without mentions is an orphan when every relationship it still
     * has was deleted in step 2; in dry-run mode those relationships are still stored.
     */
    private long pruneOrphanEntities(MaintenanceOptions options, Set<String> deletedRelationIds) {
        List<String> orphanIds = new ArrayList<>();
        for (StoredEntity entity : storage.findEntitiesWithoutMentions()) {
            if (deletedRelationIds.containsAll(entity.relationIds())) {
                orphanIds.add(entity.id());
            }
        }
        if (options.dryRun()) {
            return orphanIds.size();
        }

        long deleted = 0;
        for (int start = 0; start < orphanIds.size(); start += options.batchSize()) {
            List<GraphMutation> batch = orphanIds
                    .subList(start, Math.min(start + options.batchSize(), orphanIds.size()))
                    .stream()
                    .<GraphMutation>map(GraphMutation.DeleteEntity::new)
                    .toList();
            storage.applyBatch(batch);
            deleted += batch.size();
            log.debug("maintenance.entities.batch deleted={} total={}", batch.size(), deleted);
        }
        return deleted;
    }
}
