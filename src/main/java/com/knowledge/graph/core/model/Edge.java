package com.knowledge.graph.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A typed relationship between two graph nodes, addressed by entity key.
 * Edges are unique per (fromKey, toKey, relationshipType).
 *
 * @param relevance optional relevance score, null when the edge was never scored
 * @param attitude  1-5 sentiment of the relationship, null when not applicable
 * @param proximity 1-5 closeness of the relationship, null when not applicable
 */
public record Edge(
        String fromKey,
        String toKey,
        String relationshipType,
        Integer attitude,
        Integer proximity,
        String description,
        List<String> notes,
        Double relevance,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String MENTIONS = "MENTIONS";

    public Edge {
        Objects.requireNonNull(fromKey, "fromKey is required");
        Objects.requireNonNull(toKey, "toKey is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
        requireScale("attitude", attitude);
        requireScale("proximity", proximity);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    private static void requireScale(String field, Integer value) {
        if (value != null && (value < 1 || value > 5)) {
            throw new IllegalArgumentException(field + " must be between 1 and 5, was " + value);
        }
    }

    /**
     * The more recent of updatedAt and createdAt, or null when neither is known.
     */
    public Instant lastTouched() {
        if (updatedAt == null) {
            return createdAt;
        }
        if (createdAt == null) {
            return updatedAt;
        }
        return updatedAt.isAfter(createdAt) ? updatedAt : createdAt;
    }

    public boolean hasRelevance() {
        return relevance != null;
    }

    public String identity() {
        return fromKey + "|" + relationshipType + "|" + toKey;
    }
}
