package com.knowledge.graph.core.model;

import java.util.Arrays;

/**
 * Kinds of nodes held in a user's knowledge graph.
 * The label doubles as the graph label and as the type component of an entity key.
 */
public enum NodeType {
    PERSON("Person"),
    CONCEPT("Concept"),
    NAMED_ENTITY("Entity"),
    SOURCE("Source");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Looks up a node type by its graph label or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no type matches
     */
    public static NodeType fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node type must not be null");
        }
        return Arrays.stream(values())
                .filter(t -> t.label.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node type: " + value));
    }
}
