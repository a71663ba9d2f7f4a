package com.knowledge.graph.graph;

import java.util.regex.Pattern;

/**
 * Guards for caller-supplied values before they reach a Cypher statement or a node property.
 */
public final class InputSanitizer {

    public static final int MAX_ENTITY_NAME_LENGTH = 1000;

    /** Upper bound for notes and edge descriptions. */
    public static final int MAX_TEXT_LENGTH = 4000;

    // Spliced into query text as a label, never passed as a parameter
    private static final Pattern RELATIONSHIP_TYPE = Pattern.compile("[A-Za-z0-9_]+");

    private InputSanitizer() {
    }

    /**
     * @throws IllegalArgumentException if the name is blank, longer than
     *                                  {@link #MAX_ENTITY_NAME_LENGTH} or carries control characters
     */
    public static void validateEntityName(String name) {
        requirePrintable("Entity name", name);
        if (name.length() > MAX_ENTITY_NAME_LENGTH) {
            throw new IllegalArgumentException("Entity name is " + name.length()
                    + " characters, limit is " + MAX_ENTITY_NAME_LENGTH);
        }
    }

    public static void validateUserId(String userId) {
        requirePrintable("User id", userId);
    }

    /**
     * @throws IllegalArgumentException unless the type is a bare identifier
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType == null || !RELATIONSHIP_TYPE.matcher(relationshipType).matches()) {
            throw new IllegalArgumentException(
                    "Relationship type must be letters, digits or underscores, got: '" + relationshipType + "'");
        }
    }

    /**
     * Null is allowed; free text only has a length bound.
     */
    public static void validateText(String value) {
        if (value != null && value.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Text is " + value.length()
                    + " characters, limit is " + MAX_TEXT_LENGTH);
        }
    }

    private static void requirePrintable(String label, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be null or blank");
        }
        boolean control = value.chars()
                .anyMatch(c -> c == 0x7F || (c < 0x20 && c != '\t' && c != '\n' && c != '\r'));
        if (control) {
            throw new IllegalArgumentException(label + " must not contain control characters");
        }
    }
}
