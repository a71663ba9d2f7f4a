package com.knowledge.graph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A node as returned by graph expansion: its key, explicit type and display properties.
 */
public record GraphNode(String entityKey, NodeType type, Map<String, Object> properties) {

    public GraphNode {
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(type, "type is required");
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public String name() {
        Object name = properties.get("name");
        return name != null ? name.toString() : entityKey;
    }
}
