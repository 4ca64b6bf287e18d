package com.knowledge.extraction.quality;

import com.knowledge.extraction.metrics.ExtractionMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualityGate Tests")
class QualityGateTest {

    private static ExtractionMetrics running(int chunks, int entities) {
        return new ExtractionMetrics(chunks, entities, 0, 0, entities, 0, 0, 0, 0, 0, 0, 0L,
                Map.of(), Map.of(), Map.of());
    }

    @Nested
    @DisplayName("Entity density")
    class DensityTests {

        private final QualityGate gate = new QualityGate(QualityGateConfig.builder()
                .minEntitiesPerChunk(1.0)
                .build());

        @Test
        @DisplayName("Passes when the running density meets the minimum")
        void passes() {
            assertDoesNotThrow(() -> gate.checkEntityDensity("doc-1", running(2, 2)));
        }

        @Test
        @DisplayName("Running density below the minimum aborts with the observed value")
        void violates() {
            ThresholdViolation violation = assertThrows(ThresholdViolation.class,
                    () -> gate.checkEntityDensity("doc-1", running(2, 1)));

            assertEquals("doc-1", violation.getDocumentId());
            assertEquals(QualityGate.ENTITY_DENSITY, violation.getThresholdName());
            assertEquals(1.0, violation.getThreshold());
            assertEquals(0.5, violation.getObserved(), 1e-9);
        }

        @Test
        @DisplayName("Nothing is checked before the first chunk")
        void noChunksYet() {
            assertDoesNotThrow(() -> gate.checkEntityDensity("doc-1", ExtractionMetrics.empty()));
        }

        @Test
        @DisplayName("A zero minimum disables the check")
        void disabledCheck() {
            QualityGate lenient = new QualityGate(QualityGateConfig.builder().minEntitiesPerChunk(0.0).build());

            assertDoesNotThrow(() -> lenient.checkEntityDensity("doc-1", running(5, 0)));
        }
    }

    @Nested
    @DisplayName("Zero-relation streak")
    class StreakTests {

        private final QualityGate gate = new QualityGate(QualityGateConfig.builder()
                .zeroRelationStreakWarning(3)
                .build());

        @Test
        @DisplayName("Warns exactly when the streak reaches its length")
        void warnsAtStreakLength() {
            assertTrue(gate.observeChunk("doc-1", "c1", 0).isEmpty());
            assertTrue(gate.observeChunk("doc-1", "c2", 0).isEmpty());
            Optional<QualityWarning> warning = gate.observeChunk("doc-1", "c3", 0);
            assertTrue(gate.observeChunk("doc-1", "c4", 0).isEmpty());

            assertTrue(warning.isPresent());
            assertEquals(QualityWarning.ZERO_RELATION_STREAK, warning.get().kind());
            assertEquals("c3", warning.get().chunkId());
        }

        @Test
        @DisplayName("A chunk with relationships resets the streak")
        void resetByRelations() {
            gate.observeChunk("doc-1", "c1", 0);
            gate.observeChunk("doc-1", "c2", 0);
            gate.observeChunk("doc-1", "c3", 4);

            assertTrue(gate.observeChunk("doc-1", "c4", 0).isEmpty());
            assertTrue(gate.observeChunk("doc-1", "c5", 0).isEmpty());
            assertTrue(gate.observeChunk("doc-1", "c6", 0).isPresent());
        }

        @Test
        @DisplayName("Streaks are tracked per document")
        void perDocument() {
            gate.observeChunk("doc-1", "c1", 0);
            gate.observeChunk("doc-1", "c2", 0);
            gate.observeChunk("doc-2", "c1", 0);

            assertTrue(gate.observeChunk("doc-2", "c2", 0).isEmpty());
            assertTrue(gate.observeChunk("doc-1", "c3", 0).isPresent());
        }

        @Test
        @DisplayName("Ending a document clears its streak")
        void endDocumentClears() {
            gate.observeChunk("doc-1", "c1", 0);
            gate.observeChunk("doc-1", "c2", 0);
            gate.endDocument("doc-1");

            assertTrue(gate.observeChunk("doc-1", "c3", 0).isEmpty());
        }
    }

    @Test
    @DisplayName("Config rejects invalid values")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> QualityGateConfig.builder().minEntitiesPerChunk(-1));
        assertThrows(IllegalArgumentException.class, () -> QualityGateConfig.builder().rank3AlertThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> QualityGateConfig.builder().healthWindowSize(0));
    }
}
