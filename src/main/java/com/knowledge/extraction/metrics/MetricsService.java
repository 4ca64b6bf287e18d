package com.knowledge.extraction.metrics;

import com.knowledge.extraction.core.model.CascadeAttempt;

/**
 * Operational metrics sink. The default {@link NoOpMetricsService} records nothing,
 * so the library runs without a metrics backend.
 */
public interface MetricsService {

    void recordCascadeAttempt(CascadeAttempt attempt);

    void recordGleaningRounds(int rounds);

    /**
     * @param outcome {@code completed}, {@code aborted} or {@code failed}
     */
    void recordDocument(String outcome, ExtractionMetrics metrics);

    void recordThresholdViolation(String thresholdName);

    void recordCascadeAlert();

    /**
     * @param kind  {@code typed}, {@code relation_deleted} or {@code entity_deleted}
     * @param count number of changes of that kind
     */
    void recordMaintenanceChanges(String kind, long count);
}
