package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.SearchHit;

import java.util.List;

/**
 * A fused and salience-weighted candidate selected as an explore seed.
 *
 * @param similarity     fused similarity from rank fusion
 * @param salience       the node's salience when it was scored
 * @param combinedScore  {@code similarity + salience}
 * @param matchedSignals signals that returned the node
 */
public record ScoredNode(
        String entityKey,
        NodeType type,
        String name,
        String description,
        List<String> notes,
        double similarity,
        double salience,
        double combinedScore,
        List<String> matchedSignals
) {
    public ScoredNode {
        notes = notes == null ? List.of() : List.copyOf(notes);
        matchedSignals = matchedSignals == null ? List.of() : List.copyOf(matchedSignals);
    }

    static ScoredNode of(SearchHit hit, double similarity, double salience, List<String> matchedSignals) {
        return new ScoredNode(hit.entityKey(), hit.type(), hit.name(), hit.description(), hit.notes(),
                similarity, salience, similarity + salience, matchedSignals);
    }
}
