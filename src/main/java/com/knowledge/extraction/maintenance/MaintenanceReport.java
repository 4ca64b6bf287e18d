package com.knowledge.extraction.maintenance;

import java.util.Map;
import java.util.TreeMap;

/**
 * Result of a maintenance run. In dry-run mode the counts describe what would have changed.
 *
 * @param relationsTyped    untyped relationships that received an inferred type
 * @param relationsDeleted  untyped relationships without evidence that were removed
 * @param entitiesDeleted   orphan entities that were removed
 * @param inferredTypes     number of relationships per inferred type
 * @param dryRun            whether the graph was left untouched
 */
public record MaintenanceReport(
        long relationsTyped,
        long relationsDeleted,
        long entitiesDeleted,
        Map<String, Long> inferredTypes,
        boolean dryRun
) {
    public MaintenanceReport {
        inferredTypes = inferredTypes != null
                ? Map.copyOf(new TreeMap<>(inferredTypes)) : Map.of();
    }

    public long totalChanges() {
        return relationsTyped + relationsDeleted + entitiesDeleted;
    }

    public boolean hasChanges() {
        return totalChanges() > 0;
    }

    public static MaintenanceReport empty(boolean dryRun) {
        return new MaintenanceReport(0, 0, 0, Map.of(), dryRun);
    }

    @Override
    public String toString() {
        return "MaintenanceReport{typed=" + relationsTyped +
                ", relationsDeleted=" + relationsDeleted +
                ", entitiesDeleted=" + entitiesDeleted +
                ", types=" + new TreeMap<>(inferredTypes) +
                ", dryRun=" + dryRun + '}';
    }
}
