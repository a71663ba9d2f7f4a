package com.knowledge.graph.core.model;

import java.util.Objects;

/**
 * A surface form that resolved to an entity stored under a different name.
 */
public record Alias(
        String name,
        String normalizedName,
        NodeType type,
        String entityKey,
        String userId
) {
    public Alias {
        Objects.requireNonNull(normalizedName, "normalizedName is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(userId, "userId is required");
    }
}
