package com.knowledge.extraction.metrics;

import com.knowledge.extraction.core.model.CascadeAttempt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code extraction.cascade.attempts} (Counter, tags: rank, outcome)</li>
 *   <li>{@code extraction.model.latency} (Timer, tag: rank)</li>
 *   <li>{@code extraction.gleaning.rounds} (DistributionSummary)</li>
 *   <li>{@code extraction.documents} (Counter, tag: outcome)</li>
 *   <li>{@code extraction.relation.ratio} (DistributionSummary, completed documents)</li>
 *   <li>{@code extraction.threshold.violations} (Counter, tag: threshold)</li>
 *   <li>{@code extraction.cascade.alerts} (Counter)</li>
 *   <li>{@code maintenance.changes} (Counter, tag: kind)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary gleaningRoundsSummary;
    private final DistributionSummary relationRatioSummary;
    private final Counter cascadeAlertCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.gleaningRoundsSummary = DistributionSummary.builder("extraction.gleaning.rounds")
                .description("Gleaning rounds run per chunk")
                .register(registry);
        this.relationRatioSummary = DistributionSummary.builder("extraction.relation.ratio")
                .description("Relationships per entity of completed documents")
                .register(registry);
        this.cascadeAlertCounter = Counter.builder("extraction.cascade.alerts")
                .description("Times the rank-3 share of cascades crossed its alert threshold")
                .register(registry);
    }

    @Override
    public void recordCascadeAttempt(CascadeAttempt attempt) {
        String rank = Integer.toString(attempt.rank());
        String outcome = attempt.outcome().name();
        counter("attempt:" + rank + ":" + outcome, () -> Counter.builder("extraction.cascade.attempts")
                .description("Model calls and fallback runs made by the extraction cascade")
                .tag("rank", rank)
                .tag("outcome", outcome)
                .register(registry)).increment();

        Timer timer = timerCache.computeIfAbsent(rank, k ->
                Timer.builder("extraction.model.latency")
                        .description("Latency of model calls")
                        .tag("rank", rank)
                        .register(registry));
        timer.record(Duration.ofMillis(attempt.latencyMs()));
    }

    @Override
    public void recordGleaningRounds(int rounds) {
        gleaningRoundsSummary.record(rounds);
    }

    @Override
    public void recordDocument(String outcome, ExtractionMetrics metrics) {
        counter("document:" + outcome, () -> Counter.builder("extraction.documents")
                .description("Documents processed by the extraction pipeline")
                .tag("outcome", outcome)
                .register(registry)).increment();
        if (metrics != null) {
            relationRatioSummary.record(metrics.relationRatio());
        }
    }

    @Override
    public void recordThresholdViolation(String thresholdName) {
        counter("violation:" + thresholdName, () -> Counter.builder("extraction.threshold.violations")
                .description("Documents aborted by a hard quality threshold")
                .tag("threshold", thresholdName)
                .register(registry)).increment();
    }

    @Override
    public void recordCascadeAlert() {
        cascadeAlertCounter.increment();
    }

    @Override
    public void recordMaintenanceChanges(String kind, long count) {
        if (count <= 0) {
            return;
        }
        counter("maintenance:" + kind, () -> Counter.builder("maintenance.changes")
                .description("Graph changes made by consistency maintenance")
                .tag("kind", kind)
                .register(registry)).increment(count);
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
