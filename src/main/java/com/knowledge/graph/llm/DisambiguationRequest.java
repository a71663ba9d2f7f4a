package com.knowledge.graph.llm;

import com.knowledge.graph.core.model.Mention;
import com.knowledge.graph.core.model.SearchHit;

import java.util.List;
import java.util.Objects;

/**
 * A mention together with the closest existing nodes, best first.
 */
public record DisambiguationRequest(Mention candidate, List<SearchHit> topMatches) {

    public DisambiguationRequest {
        Objects.requireNonNull(candidate, "candidate is required");
        topMatches = topMatches == null ? List.of() : List.copyOf(topMatches);
    }
}
