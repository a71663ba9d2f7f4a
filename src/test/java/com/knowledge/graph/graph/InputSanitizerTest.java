package com.knowledge.graph.graph;

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
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("a".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH)));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName("a".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH + 1)));
    }

    @Test
    void validateEntityName_rejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName("Machine\u0000learning"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateEntityName("Machine\u007Flearning"));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Machine\tlearning"));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Zoë's café"));
    }

    // ========== validateUserId ==========

    @Test
    void validateUserId_rejectsBlankAndControlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateUserId(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateUserId(""));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateUserId("user\u0001"));
        assertDoesNotThrow(() -> InputSanitizer.validateUserId("user-42"));
    }

    // ========== validateRelationshipType ==========

    @Test
    void validateRelationshipType_acceptsIdentifiers() {
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType("WORKS_ON"));
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType("MENTIONS"));
    }

    @Test
    void validateRelationshipType_rejectsInjection() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("KNOWS]->(x) DELETE x//"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("HAS SPACE"));
    }

    // ========== validateText ==========

    @Test
    void validateText_allowsNullAndEnforcesLength() {
        assertDoesNotThrow(() -> InputSanitizer.validateText(null));
        assertDoesNotThrow(() -> InputSanitizer.validateText("x".repeat(InputSanitizer.MAX_TEXT_LENGTH)));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateText("x".repeat(InputSanitizer.MAX_TEXT_LENGTH + 1)));
    }
}
