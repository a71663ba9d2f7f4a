package com.knowledge.graph.retrieval;

import java.util.Objects;

/**
 * A semantic query with its minimum cosine similarity.
 */
public record QueryInput(String query, double threshold) {

    public static final double DEFAULT_THRESHOLD = 0.7;

    public QueryInput {
        Objects.requireNonNull(query, "query is required");
        if (query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, was " + threshold);
        }
    }

    public static QueryInput of(String query) {
        return new QueryInput(query, DEFAULT_THRESHOLD);
    }
}
