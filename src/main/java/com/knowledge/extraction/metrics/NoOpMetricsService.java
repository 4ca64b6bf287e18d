package com.knowledge.extraction.metrics;

import com.knowledge.extraction.core.model.CascadeAttempt;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCascadeAttempt(CascadeAttempt attempt) {
    }

    @Override
    public void recordGleaningRounds(int rounds) {
    }

    @Override
    public void recordDocument(String outcome, ExtractionMetrics metrics) {
    }

    @Override
    public void recordThresholdViolation(String thresholdName) {
    }

    @Override
    public void recordCascadeAlert() {
    }

    @Override
    public void recordMaintenanceChanges(String kind, long count) {
    }
}
