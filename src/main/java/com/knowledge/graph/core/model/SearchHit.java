package com.knowledge.graph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A scored node returned by one of the store's search capabilities.
 */
public record SearchHit(
        String entityKey,
        NodeType type,
        double score,
        String name,
        String description,
        List<String> notes
) {
    public SearchHit {
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(type, "type is required");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public SearchHit withScore(double newScore) {
        return new SearchHit(entityKey, type, newScore, name, description, notes);
    }
}
