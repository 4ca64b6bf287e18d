package com.knowledge.extraction.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== validateEntityName ==========

    @Test
    void validateEntityName_rejectsNullAndBlank() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName("   "));
    }

    @Test
    void validateEntityName_enforcesMaxLength() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName("A".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH + 1)));
        assertDoesNotThrow(
                () -> InputSanitizer.validateEntityName("A".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH)));
    }

    @Test
    void validateEntityName_rejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName("Acme\u0000Corp"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName("Acme\u007FCorp"));
    }

    @Test
    void validateEntityName_acceptsModelOutput() {
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Société Générale"));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("O'Brien & Sons (Dublin)"));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Line one\nline two"));
    }

    // ========== validateRelationshipType ==========

    @Test
    void validateRelationshipType_acceptsUpperSnakeCaseAndNull() {
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType("LOCATED_IN"));
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType(null));
    }

    @Test
    void validateRelationshipType_rejectsInjection() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateRelationshipType("OWNS]->() DELETE"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("OWNS BY"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType(""));
    }

    // ========== truncate ==========

    @Test
    void truncate_limitsLongValues() {
        String longValue = "x".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 10);

        assertEquals(InputSanitizer.MAX_CYPHER_VALUE_LENGTH, InputSanitizer.truncate(longValue).length());
        assertEquals("short", InputSanitizer.truncate("short"));
        assertNull(InputSanitizer.truncate(null));
    }
}
