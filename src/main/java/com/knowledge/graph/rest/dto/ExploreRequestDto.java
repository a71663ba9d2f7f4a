package com.knowledge.graph.rest.dto;

import com.knowledge.graph.retrieval.ExploreRequest;
import com.knowledge.graph.retrieval.QueryInput;

import java.util.List;
import java.util.Objects;

/**
 * Request DTO for explore. Missing flags take their defaults: relationship search on,
 * explanations off, markdown off.
 */
public record ExploreRequestDto(
        String userId,
        List<QueryDto> queries,
        List<String> textMatches,
        Boolean searchRelationships,
        Boolean returnExplanations,
        Boolean markdown
) {
    public ExploreRequestDto {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        queries = queries == null ? List.of() : List.copyOf(queries);
        textMatches = textMatches == null ? List.of() : textMatches.stream().filter(Objects::nonNull).toList();
    }

    public record QueryDto(String query, Double threshold) {
        public QueryDto {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("query is required");
            }
        }

        QueryInput toInput() {
            return new QueryInput(query, threshold != null ? threshold : QueryInput.DEFAULT_THRESHOLD);
        }
    }

    public ExploreRequest toRequest() {
        return new ExploreRequest(userId,
                queries.stream().map(QueryDto::toInput).toList(),
                textMatches,
                searchRelationships == null || searchRelationships,
                returnExplanations != null && returnExplanations);
    }

    public boolean wantsMarkdown() {
        return markdown != null && markdown;
    }
}
