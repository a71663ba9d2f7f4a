package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Edge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdgeOrdering Tests")
class EdgeOrderingTest {

    private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-06-01T00:00:00Z");

    private static Edge edge(String to, Double relevance, Instant createdAt, Instant updatedAt) {
        return new Edge("a", to, "RELATED_TO", null, null, null, List.of(), relevance, createdAt, updatedAt);
    }

    @Test
    @DisplayName("Scored edges come first by relevance, then unscored by recency")
    void relevanceThenRecency() {
        Edge high = edge("high", 0.9, T1, T1);
        Edge recent = edge("recent", null, T1, T2);
        Edge low = edge("low", 0.5, T2, T2);
        Edge old = edge("old", null, T1, T1);

        List<Edge> ordered = EdgeOrdering.top(List.of(high, recent, low, old), 10);

        assertEquals(List.of(high, low, recent, old), ordered);
    }

    @Test
    @DisplayName("Recency uses the later of created and updated")
    void laterTimestampWins() {
        Edge createdLate = edge("x", null, T2, null);
        Edge updatedEarly = edge("y", null, T1, T1);

        assertEquals(List.of(createdLate, updatedEarly), EdgeOrdering.top(List.of(updatedEarly, createdLate), 10));
    }

    @Test
    @DisplayName("Edges without timestamps sort last")
    void missingTimestampsLast() {
        Edge undated = edge("u", null, null, null);
        Edge dated = edge("d", null, T1, null);

        assertEquals(List.of(dated, undated), EdgeOrdering.top(List.of(undated, dated), 10));
    }

    @Test
    @DisplayName("Output is capped")
    void capped() {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            edges.add(edge("n" + i, i / 100.0, T1, T1));
        }
        List<Edge> top = EdgeOrdering.top(edges, 10);
        assertEquals(10, top.size());
        assertEquals(0.24, top.get(0).relevance(), 1e-9);
    }
}
