package com.knowledge.graph.rest.dto;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.GraphNode;
import com.knowledge.graph.retrieval.ExploreExplanations;
import com.knowledge.graph.retrieval.ExploreResult;
import com.knowledge.graph.retrieval.ScoredNode;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for explore. Timestamps are epoch milliseconds.
 */
public record ExploreResponse(
        List<ScoredNode> seeds,
        List<NodeResponse> nodes,
        List<EdgeResponse> edges,
        Map<String, List<String>> neighbors,
        ExploreExplanations explanations,
        String markdown
) {
    public record NodeResponse(String entityKey, String type, Map<String, Object> properties) {
        static NodeResponse from(GraphNode node) {
            return new NodeResponse(node.entityKey(), node.type().getLabel(), node.properties());
        }
    }

    public record EdgeResponse(
            String from,
            String to,
            String type,
            String description,
            Double relevance,
            Integer attitude,
            Integer proximity,
            Long updatedAt
    ) {
        static EdgeResponse from(Edge edge) {
            return new EdgeResponse(edge.fromKey(), edge.toKey(), edge.relationshipType(),
                    edge.description(), edge.relevance(), edge.attitude(), edge.proximity(),
                    edge.lastTouched() != null ? edge.lastTouched().toEpochMilli() : null);
        }
    }

    public static ExploreResponse from(ExploreResult result, String markdown) {
        return new ExploreResponse(
                result.seeds(),
                result.nodes().stream().map(NodeResponse::from).toList(),
                result.edges().stream().map(EdgeResponse::from).toList(),
                result.neighbors(),
                result.explanations(),
                markdown);
    }
}
