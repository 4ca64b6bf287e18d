package com.knowledge.extraction.dedup;

import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Collapses entities by canonical key and relationships by merge key.
 *
 * <p>Entity merge: the first-seen name, type and description win (a blank first-seen
 * description is filled by the next non-blank one), confidence is the maximum and
 * source chunk ids are unioned. Relationship merge: maximum confidence, the longer
 * description, chunk ids unioned, and the unresolved flag only survives if every
 * merged copy carried it.</p>
 *
 * <p>Output order is first-seen order and the merge is idempotent: deduplicating an
 * already deduplicated list returns equal items.</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final Supplier<String> idGenerator;

    public Deduplicator() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * @param idGenerator source of ids for items that have none yet
     */
    public Deduplicator(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public MergeOutcome<Entity> mergeEntities(List<Entity> entities) {
        Map<String, Entity> byKey = new LinkedHashMap<>();
        for (Entity entity : entities) {
            byKey.merge(entity.getCanonicalKey(), entity, this::mergeEntity);
        }
        List<Entity> merged = byKey.values().stream()
                .map(e -> e.getId() != null ? e : Entity.builder(e).id(idGenerator.get()).build())
                .toList();
        MergeOutcome<Entity> outcome = MergeOutcome.of(merged, entities.size());
        if (outcome.duplicatesRemoved() > 0) {
            log.debug("dedup.entities raw={} unique={} removed={}",
                    outcome.rawCount(), merged.size(), outcome.duplicatesRemoved());
        }
        return outcome;
    }

    public MergeOutcome<Relationship> mergeRelations(List<Relationship> relations) {
        Map<String, Relationship> byKey = new LinkedHashMap<>();
        for (Relationship relation : relations) {
            byKey.merge(relation.getMergeKey(), relation, this::mergeRelation);
        }
        List<Relationship> merged = byKey.values().stream()
                .map(r -> r.getId() != null ? r : Relationship.builder(r).id(idGenerator.get()).build())
                .toList();
        MergeOutcome<Relationship> outcome = MergeOutcome.of(merged, relations.size());
        if (outcome.duplicatesRemoved() > 0) {
            log.debug("dedup.relations raw={} unique={} removed={}",
                    outcome.rawCount(), merged.size(), outcome.duplicatesRemoved());
        }
        return outcome;
    }

    private Entity mergeEntity(Entity first, Entity next) {
        String description = first.getDescription().isBlank() ? next.getDescription() : first.getDescription();
        return Entity.builder(first)
                .id(first.getId() != null ? first.getId() : next.getId())
                .description(description)
                .confidence(Math.max(first.getConfidence(), next.getConfidence()))
                .sourceChunkIds(union(first.getSourceChunkIds(), next.getSourceChunkIds()))
                .build();
    }

    private Relationship mergeRelation(Relationship first, Relationship next) {
        String description = next.getDescription().length() > first.getDescription().length()
                ? next.getDescription()
                : first.getDescription();
        return Relationship.builder(first)
                .id(first.getId() != null ? first.getId() : next.getId())
                .description(description)
                .confidence(Math.max(first.getConfidence(), next.getConfidence()))
                .sourceChunkIds(union(first.getSourceChunkIds(), next.getSourceChunkIds()))
                .unresolvedReference(first.isUnresolvedReference() && next.isUnresolvedReference())
                .build();
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> union = new LinkedHashSet<>(a);
        union.addAll(b);
        return union;
    }
}
