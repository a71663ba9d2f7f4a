package com.knowledge.graph.core.model;

import java.util.List;
import java.util.Map;

/**
 * Result of a bounded one-hop expansion around a seed set of entity keys.
 *
 * @param nodes     seed nodes plus their direct neighbors
 * @param edges     edges among seeds, to the owner and to one-hop neighbors
 * @param neighbors seed key to the keys of its direct neighbors
 */
public record ExpandedGraph(
        List<GraphNode> nodes,
        List<Edge> edges,
        Map<String, List<String>> neighbors
) {
    public ExpandedGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        neighbors = neighbors == null ? Map.of() : Map.copyOf(neighbors);
    }

    public static ExpandedGraph empty() {
        return new ExpandedGraph(List.of(), List.of(), Map.of());
    }
}
