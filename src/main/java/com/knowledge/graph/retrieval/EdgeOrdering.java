package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Edge;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Display order for edges: scored edges first by relevance descending, then by the
 * more recent of updated/created descending. Edges with no timestamp sort last.
 */
public final class EdgeOrdering {

    public static final Comparator<Edge> COMPARATOR = Comparator
            .comparing((Edge e) -> e.hasRelevance() ? 0 : 1)
            .thenComparing((Edge e) -> e.hasRelevance() ? e.relevance() : 0.0, Comparator.<Double>reverseOrder())
            .thenComparing(Edge::lastTouched, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private EdgeOrdering() {
    }

    public static List<Edge> top(List<Edge> edges, int limit) {
        return edges.stream()
                .sorted(COMPARATOR)
                .limit(limit)
                .toList();
    }
}
