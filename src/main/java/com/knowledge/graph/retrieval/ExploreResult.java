package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.GraphNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranked seeds, their one-hop neighborhood and the top edges.
 *
 * @param seeds        selected nodes in selection order (by type, then combined score)
 * @param nodes        seeds and neighbors with display properties
 * @param edges        top edges in {@link EdgeOrdering} order
 * @param neighbors    seed key to neighbor keys
 * @param explanations present only when requested
 */
public record ExploreResult(
        List<ScoredNode> seeds,
        List<GraphNode> nodes,
        List<Edge> edges,
        Map<String, List<String>> neighbors,
        ExploreExplanations explanations
) {
    public ExploreResult {
        seeds = List.copyOf(seeds);
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        neighbors = Map.copyOf(neighbors);
    }

    public static ExploreResult empty(ExploreExplanations explanations) {
        return new ExploreResult(List.of(), List.of(), List.of(), Map.of(), explanations);
    }

    public Optional<ExploreExplanations> getExplanations() {
        return Optional.ofNullable(explanations);
    }

    public Optional<ScoredNode> seed(String entityKey) {
        return seeds.stream().filter(s -> s.entityKey().equals(entityKey)).findFirst();
    }

    public boolean isEmpty() {
        return seeds.isEmpty();
    }
}
