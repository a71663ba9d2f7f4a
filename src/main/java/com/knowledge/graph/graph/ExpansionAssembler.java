package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.GraphNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds a bounded one-hop neighborhood from the edges incident to a seed set.
 * Neighbors beyond {@link #MAX_NEIGHBORS} are dropped along with their edges.
 */
final class ExpansionAssembler {

    static final int MAX_NEIGHBORS = 30;
    static final int MAX_INCIDENT_EDGES = 200;

    private ExpansionAssembler() {
    }

    static ExpandedGraph assemble(List<String> seedKeys, Collection<Edge> incidentEdges,
                                  Function<Collection<String>, List<GraphNode>> loadNodes) {
        Set<String> seeds = new LinkedHashSet<>(seedKeys);
        Set<String> neighborKeys = new LinkedHashSet<>();
        for (Edge edge : incidentEdges) {
            for (String key : List.of(edge.fromKey(), edge.toKey())) {
                if (!seeds.contains(key) && neighborKeys.size() < MAX_NEIGHBORS) {
                    neighborKeys.add(key);
                }
            }
        }

        Set<String> kept = new LinkedHashSet<>(seeds);
        kept.addAll(neighborKeys);

        List<Edge> edges = new ArrayList<>();
        Set<String> seenEdges = new LinkedHashSet<>();
        Map<String, Set<String>> neighbors = new LinkedHashMap<>();
        for (Edge edge : incidentEdges) {
            if (!kept.contains(edge.fromKey()) || !kept.contains(edge.toKey()) || !seenEdges.add(edge.identity())) {
                continue;
            }
            edges.add(edge);
            link(neighbors, seeds, edge.fromKey(), edge.toKey());
            link(neighbors, seeds, edge.toKey(), edge.fromKey());
        }

        Map<String, GraphNode> nodesByKey = new LinkedHashMap<>();
        for (GraphNode node : loadNodes.apply(kept)) {
            nodesByKey.put(node.entityKey(), node);
        }
        List<GraphNode> nodes = new ArrayList<>();
        for (String key : kept) {
            Optional.ofNullable(nodesByKey.get(key)).ifPresent(nodes::add);
        }

        Map<String, List<String>> neighborLists = new LinkedHashMap<>();
        neighbors.forEach((key, values) -> neighborLists.put(key, List.copyOf(values)));
        return new ExpandedGraph(nodes, edges, neighborLists);
    }

    private static void link(Map<String, Set<String>> neighbors, Set<String> seeds, String from, String to) {
        if (seeds.contains(from) && !from.equals(to)) {
            neighbors.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        }
    }
}
