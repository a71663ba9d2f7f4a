package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One-hop expansion of a seed set, with edges ordered for display and capped.
 */
public class GraphExpander {
    private static final Logger log = LoggerFactory.getLogger(GraphExpander.class);

    private final KnowledgeGraphStore store;
    private final int maxEdges;

    public GraphExpander(KnowledgeGraphStore store, int maxEdges) {
        this.store = store;
        this.maxEdges = maxEdges;
    }

    public ExpandedGraph expand(List<String> seedKeys, String userId) {
        if (seedKeys.isEmpty()) {
            return ExpandedGraph.empty();
        }
        ExpandedGraph graph = store.expandGraph(seedKeys, userId);
        ExpandedGraph ordered = new ExpandedGraph(graph.nodes(), EdgeOrdering.top(graph.edges(), maxEdges),
                graph.neighbors());
        log.debug("graph.expanded seeds={} nodes={} edges={} keptEdges={}",
                seedKeys.size(), graph.nodes().size(), graph.edges().size(), ordered.edges().size());
        return ordered;
    }
}
