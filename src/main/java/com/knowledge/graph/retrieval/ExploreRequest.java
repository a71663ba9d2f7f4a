package com.knowledge.graph.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Input to {@link RetrievalOrchestrator#explore}. At least one query or text match
 * must be present for the call to succeed.
 */
public record ExploreRequest(
        String userId,
        List<QueryInput> queries,
        List<String> textMatches,
        boolean searchRelationships,
        boolean returnExplanations
) {
    public ExploreRequest {
        Objects.requireNonNull(userId, "userId is required");
        queries = queries == null ? List.of() : List.copyOf(queries);
        textMatches = textMatches == null ? List.of() : textMatches.stream()
                .filter(Objects::nonNull)
                .filter(t -> !t.isBlank())
                .toList();
    }

    public boolean hasCriteria() {
        return !queries.isEmpty() || !textMatches.isEmpty();
    }

    public static Builder builder(String userId) {
        return new Builder(userId);
    }

    public static class Builder {
        private final String userId;
        private final List<QueryInput> queries = new ArrayList<>();
        private final List<String> textMatches = new ArrayList<>();
        private boolean searchRelationships = true;
        private boolean returnExplanations = false;

        private Builder(String userId) {
            this.userId = userId;
        }

        public Builder query(String query, double threshold) {
            queries.add(new QueryInput(query, threshold));
            return this;
        }

        public Builder query(QueryInput query) {
            queries.add(query);
            return this;
        }

        public Builder textMatch(String text) {
            textMatches.add(text);
            return this;
        }

        public Builder searchRelationships(boolean searchRelationships) {
            this.searchRelationships = searchRelationships;
            return this;
        }

        public Builder returnExplanations(boolean returnExplanations) {
            this.returnExplanations = returnExplanations;
            return this;
        }

        public ExploreRequest build() {
            return new ExploreRequest(userId, queries, textMatches, searchRelationships, returnExplanations);
        }
    }
}
