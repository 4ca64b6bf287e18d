package com.knowledge.extraction.metrics;

import com.knowledge.extraction.core.model.CascadeAttempt;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MicrometerMetricsService Tests")
class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new MicrometerMetricsService(registry);
    }

    private static CascadeAttempt attempt(int rank, CascadeAttempt.Outcome outcome, long latencyMs) {
        return new CascadeAttempt(rank, "model-" + rank, latencyMs, outcome.isSuccess(), "c1", "cascade-1",
                outcome, Instant.now());
    }

    @Test
    @DisplayName("Cascade attempts are counted by rank and outcome")
    void cascadeAttempts() {
        service.recordCascadeAttempt(attempt(1, CascadeAttempt.Outcome.TIMEOUT, 300));
        service.recordCascadeAttempt(attempt(1, CascadeAttempt.Outcome.TIMEOUT, 300));
        service.recordCascadeAttempt(attempt(2, CascadeAttempt.Outcome.SUCCESS, 100));

        assertEquals(2.0, registry.get("extraction.cascade.attempts")
                .tag("rank", "1").tag("outcome", "TIMEOUT").counter().count());
        assertEquals(1.0, registry.get("extraction.cascade.attempts")
                .tag("rank", "2").tag("outcome", "SUCCESS").counter().count());
        assertEquals(600.0, registry.get("extraction.model.latency").tag("rank", "1").timer()
                .totalTime(TimeUnit.MILLISECONDS), 1e-6);
    }

    @Test
    @DisplayName("Documents are counted by outcome with the relation ratio of finished ones")
    void documents() {
        ExtractionMetrics metrics = new ExtractionMetrics(1, 4, 3, 0, 4, 3, 0, 0, 0, 0, 2, 10L,
                Map.of(), Map.of(), Map.of());

        service.recordDocument("completed", metrics);
        service.recordDocument("aborted", null);

        assertEquals(1.0, registry.get("extraction.documents").tag("outcome", "completed").counter().count());
        assertEquals(1.0, registry.get("extraction.documents").tag("outcome", "aborted").counter().count());
        assertEquals(1, registry.get("extraction.relation.ratio").summary().count());
        assertEquals(0.75, registry.get("extraction.relation.ratio").summary().totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("Violations, alerts and gleaning rounds are recorded")
    void qualitySignals() {
        service.recordThresholdViolation("minEntitiesPerChunk");
        service.recordCascadeAlert();
        service.recordGleaningRounds(2);

        assertEquals(1.0, registry.get("extraction.threshold.violations")
                .tag("threshold", "minEntitiesPerChunk").counter().count());
        assertEquals(1.0, registry.get("extraction.cascade.alerts").counter().count());
        assertEquals(2.0, registry.get("extraction.gleaning.rounds").summary().totalAmount());
    }

    @Test
    @DisplayName("Maintenance changes are counted by kind and zero counts are skipped")
    void maintenanceChanges() {
        service.recordMaintenanceChanges("typed", 5);
        service.recordMaintenanceChanges("entity_deleted", 0);

        assertEquals(5.0, registry.get("maintenance.changes").tag("kind", "typed").counter().count());
        assertNull(registry.find("maintenance.changes").tag("kind", "entity_deleted").counter());
    }
}
