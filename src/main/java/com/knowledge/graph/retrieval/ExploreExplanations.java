package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.NodeType;

import java.util.Map;

/**
 * How an explore result was assembled.
 *
 * @param signalHits      unique hits per signal name
 * @param totalUniqueHits distinct nodes across all signals
 * @param fusedCandidates candidates kept after fusion
 * @param selectedByType  seeds selected per node type
 */
public record ExploreExplanations(
        Map<String, Integer> signalHits,
        int totalUniqueHits,
        int fusedCandidates,
        Map<NodeType, Integer> selectedByType
) {
    public ExploreExplanations {
        signalHits = Map.copyOf(signalHits);
        selectedByType = Map.copyOf(selectedByType);
    }
}
