package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.EntityState;
import com.knowledge.graph.core.model.ExpandedGraph;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.graph.GraphStoreException;
import com.knowledge.graph.graph.InMemoryKnowledgeGraphStore;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.metrics.MetricsService;
import com.knowledge.graph.metrics.NoOpMetricsService;
import com.knowledge.graph.normalization.EntityKeys;
import com.knowledge.graph.salience.SalienceTracker;
import com.knowledge.graph.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("RetrievalOrchestrator Tests")
class RetrievalOrchestratorTest {

    private static final String USER = "u1";
    private static final float[] ML_VECTOR = {1f, 0f};

    private ExecutorService executor;
    private EmbeddingProvider embeddingProvider;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        embeddingProvider = mock(EmbeddingProvider.class);
        when(embeddingProvider.embed(anyString())).thenReturn(new float[0]);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RetrievalOrchestrator orchestrator(KnowledgeGraphStore store, RetrievalOptions options,
                                               MetricsService metrics) {
        return new RetrievalOrchestrator(store, embeddingProvider, new SalienceTracker(store, metrics),
                options, metrics, new NoOpTracingService(), executor);
    }

    private RetrievalOrchestrator orchestrator(KnowledgeGraphStore store) {
        return orchestrator(store, RetrievalOptions.defaults(), new NoOpMetricsService());
    }

    private static Entity entity(String name, NodeType type, float[] embedding, double salience) {
        return Entity.builder()
                .entityKey(EntityKeys.entityKey(name, type, USER))
                .userId(USER)
                .type(type)
                .name(name)
                .embedding(embedding)
                .salience(salience)
                .build();
    }

    private static float[] atSimilarity(double similarity) {
        return new float[]{(float) similarity, (float) Math.sqrt(1 - similarity * similarity)};
    }

    /** Similarity of a single first-ranked candidate in a fusion without boosts. */
    private static double firstPlaceSimilarity() {
        double rrf = 1.0 / 61;
        return 0.3 + (rrf - 0.01) / (0.05 - 0.01) * (0.6 - 0.3);
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("No queries and no text matches is an invalid argument")
        void emptyRequest() {
            KnowledgeGraphStore store = mock(KnowledgeGraphStore.class);
            ExploreRequest request = ExploreRequest.builder(USER).build();

            assertThrows(IllegalArgumentException.class, () -> orchestrator(store).explore(request));
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("Blank text matches do not count as criteria")
        void blankTextMatches() {
            ExploreRequest request = ExploreRequest.builder(USER).textMatch("  ").build();
            assertFalse(request.hasCriteria());
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        private InMemoryKnowledgeGraphStore store;
        private Entity ml;

        @BeforeEach
        void setUp() {
            store = new InMemoryKnowledgeGraphStore();
            ml = entity("Machine learning", NodeType.CONCEPT, ML_VECTOR, 0.5);
            store.save(ml);
            when(embeddingProvider.embed("machine learning")).thenReturn(atSimilarity(0.95));
        }

        @Test
        @DisplayName("Combined score is fused similarity plus current salience")
        void combinedScore() {
            ExploreResult result = orchestrator(store).explore(ExploreRequest.builder(USER)
                    .query("machine learning", 0.7)
                    .build());

            ScoredNode node = result.seed(ml.getEntityKey()).orElseThrow();
            assertEquals(firstPlaceSimilarity(), node.similarity(), 1e-9);
            assertEquals(0.5, node.salience(), 1e-9);
            assertEquals(node.similarity() + node.salience(), node.combinedScore(), 1e-12);
            assertEquals(List.of(RetrievalOrchestrator.SIGNAL_EMBEDDING), node.matchedSignals());
        }

        @Test
        @DisplayName("Salience reorders candidates with similar relevance")
        void salienceReorders() {
            Entity dl = entity("Deep learning", NodeType.CONCEPT, new float[]{0.8f, 0.6f}, 0.95);
            store.save(dl);

            ExploreResult result = orchestrator(store).explore(ExploreRequest.builder(USER)
                    .query("machine learning", 0.7)
                    .build());

            // ml ranks first on similarity, dl wins on salience
            assertEquals(dl.getEntityKey(), result.seeds().get(0).entityKey());
        }

        @Test
        @DisplayName("Nodes below the query threshold are not returned")
        void thresholdApplied() {
            ExploreResult result = orchestrator(store).explore(ExploreRequest.builder(USER)
                    .query("machine learning", 0.99)
                    .build());

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("Text and vector agreement fuses into one seed")
        void signalsFuse() {
            ExploreResult result = orchestrator(store).explore(ExploreRequest.builder(USER)
                    .query("machine learning", 0.7)
                    .textMatch("Machine learning")
                    .build());

            assertEquals(1, result.seeds().size());
            assertEquals(List.of(RetrievalOrchestrator.SIGNAL_EMBEDDING, RetrievalOrchestrator.SIGNAL_FUZZY),
                    result.seeds().get(0).matchedSignals());
        }

        @Test
        @DisplayName("Selected seeds are counted as accessed")
        void accessRecorded() {
            orchestrator(store).explore(ExploreRequest.builder(USER).query("machine learning", 0.7).build());

            Entity after = store.findByEntityKey(ml.getEntityKey()).orElseThrow();
            assertEquals(1, after.getAccessCount());
            assertEquals(EntityState.ACTIVE, after.getState());
        }

        @Test
        @DisplayName("Access recording can be switched off")
        void accessRecordingDisabled() {
            orchestrator(store, RetrievalOptions.builder().recordAccess(false).build(), new NoOpMetricsService())
                    .explore(ExploreRequest.builder(USER).query("machine learning", 0.7).build());

            assertEquals(0, store.findByEntityKey(ml.getEntityKey()).orElseThrow().getAccessCount());
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Per-type caps are applied and concatenated Concept, Entity, Person, Source")
        void typeCaps() {
            InMemoryKnowledgeGraphStore store = new InMemoryKnowledgeGraphStore();
            for (int i = 0; i < 7; i++) {
                store.save(entity("person " + i, NodeType.PERSON, null, 0.5));
                store.save(entity("concept " + i, NodeType.CONCEPT, null, 0.5));
            }
            store.save(entity("entity 0", NodeType.NAMED_ENTITY, null, 0.5));

            ExploreResult result = orchestrator(store).explore(ExploreRequest.builder(USER)
                    .textMatch("person")
                    .textMatch("concept")
                    .textMatch("entity")
                    .returnExplanations(true)
                    .build());

            Map<NodeType, Integer> selected = result.getExplanations().orElseThrow().selectedByType();
            assertEquals(5, selected.get(NodeType.CONCEPT));
            assertEquals(1, selected.get(NodeType.NAMED_ENTITY));
            assertEquals(3, selected.get(NodeType.PERSON));

            List<NodeType> types = result.seeds().stream().map(ScoredNode::type).toList();
            assertEquals(NodeType.CONCEPT, types.get(0));
            assertEquals(NodeType.NAMED_ENTITY, types.get(5));
            assertEquals(NodeType.PERSON, types.get(6));
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("A failing signal is dropped and the others still return results")
        void failedSignalDegrades() {
            KnowledgeGraphStore store = mock(KnowledgeGraphStore.class);
            MetricsService metrics = mock(MetricsService.class);
            SearchHit hit = new SearchHit("k1", NodeType.CONCEPT, 0.9, "Machine learning", null, List.of());
            when(embeddingProvider.embed("ml")).thenReturn(ML_VECTOR);
            when(store.vectorSearch(any(), anyDouble(), eq(USER))).thenThrow(new GraphStoreException("vector index down"));
            when(store.findNodesViaRelationshipSearch(any(), anyDouble(), eq(USER))).thenReturn(List.of());
            when(store.fuzzyTextMatch("machine", USER)).thenReturn(List.of(hit));
            when(store.calculateSalience(anyCollection())).thenReturn(Map.of("k1", 0.5));
            when(store.expandGraph(anyList(), eq(USER))).thenReturn(ExpandedGraph.empty());

            ExploreResult result = orchestrator(store, RetrievalOptions.defaults(), metrics)
                    .explore(ExploreRequest.builder(USER).query("ml", 0.7).textMatch("machine").build());

            assertEquals(List.of("k1"), result.seeds().stream().map(ScoredNode::entityKey).toList());
            verify(metrics).incrementSignalFailure(RetrievalOrchestrator.SIGNAL_EMBEDDING);
        }

        @Test
        @DisplayName("A signal exceeding its deadline is treated as empty")
        void timedOutSignalDegrades() throws Exception {
            KnowledgeGraphStore store = mock(KnowledgeGraphStore.class);
            MetricsService metrics = mock(MetricsService.class);
            CountDownLatch release = new CountDownLatch(1);
            SearchHit hit = new SearchHit("k1", NodeType.CONCEPT, 0.9, "Machine learning", null, List.of());
            when(store.fuzzyTextMatch("slow", USER)).thenAnswer(inv -> {
                release.await();
                return List.of(hit);
            });
            when(store.fuzzyTextMatch("fast", USER)).thenReturn(List.of(hit));
            when(store.calculateSalience(anyCollection())).thenReturn(Map.of());
            when(store.expandGraph(anyList(), eq(USER))).thenReturn(ExpandedGraph.empty());

            RetrievalOptions options = RetrievalOptions.builder().signalTimeout(Duration.ofMillis(100)).build();
            try {
                ExploreResult result = orchestrator(store, options, metrics)
                        .explore(ExploreRequest.builder(USER).textMatch("slow").textMatch("fast").build());

                assertEquals(1, result.seeds().size());
                verify(metrics).incrementSignalFailure(RetrievalOrchestrator.SIGNAL_FUZZY);
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("A failure while recording access does not fail explore")
        void accessFailureSwallowed() {
            KnowledgeGraphStore store = mock(KnowledgeGraphStore.class);
            SearchHit hit = new SearchHit("k1", NodeType.CONCEPT, 0.9, "Machine learning", null, List.of());
            when(store.fuzzyTextMatch("machine", USER)).thenReturn(List.of(hit));
            when(store.calculateSalience(anyCollection())).thenReturn(Map.of("k1", 0.5));
            when(store.expandGraph(anyList(), eq(USER))).thenReturn(ExpandedGraph.empty());
            doThrow(new GraphStoreException("write failed")).when(store).applySalienceUpdate(anyCollection(), any());

            ExploreResult result = orchestrator(store)
                    .explore(ExploreRequest.builder(USER).textMatch("machine").build());

            assertEquals(1, result.seeds().size());
        }
    }

    @Nested
    @DisplayName("Expansion")
    class Expansion {

        @Test
        @DisplayName("Seeds are expanded one hop with ordered edges and a neighbor map")
        void oneHop() {
            InMemoryKnowledgeGraphStore store = new InMemoryKnowledgeGraphStore();
            Entity ml = entity("Machine learning", NodeType.CONCEPT, null, 0.5);
            Entity alice = entity("Alice", NodeType.PERSON, null, 0.5);
            Entity bob = entity("Bob", NodeType.PERSON, null, 0.5);
            store.save(ml);
            store.save(alice);
            store.save(bob);
            Instant now = Instant.now();
            store.upsertEdge(new Edge(alice.getEntityKey(), ml.getEntityKey(), "STUDIES", null, null,
                    null, List.of(), null, now, now), null);
            store.upsertEdge(new Edge(bob.getEntityKey(), ml.getEntityKey(), "TEACHES", null, null,
                    null, List.of(), 0.8, now, now), null);

            ExploreResult result = orchestrator(store)
                    .explore(ExploreRequest.builder(USER).textMatch("Machine learning").build());

            assertEquals(List.of(ml.getEntityKey()), result.seeds().stream().map(ScoredNode::entityKey).toList());
            assertEquals(3, result.nodes().size());
            assertEquals("TEACHES", result.edges().get(0).relationshipType());
            assertEquals("STUDIES", result.edges().get(1).relationshipType());
            assertEquals(2, result.neighbors().get(ml.getEntityKey()).size());
        }

        @Test
        @DisplayName("Internal properties are not returned")
        void internalPropertiesFiltered() {
            InMemoryKnowledgeGraphStore store = new InMemoryKnowledgeGraphStore();
            store.save(entity("Machine learning", NodeType.CONCEPT, ML_VECTOR, 0.5));

            ExploreResult result = orchestrator(store)
                    .explore(ExploreRequest.builder(USER).textMatch("Machine learning").build());

            Map<String, Object> properties = result.nodes().get(0).properties();
            assertFalse(properties.containsKey("embedding"));
            assertFalse(properties.containsKey("recall_frequency"));
            assertEquals("Machine learning", properties.get("name"));
        }
    }

    @Nested
    @DisplayName("Explanations")
    class Explanations {

        @Test
        @DisplayName("Explanations are present only when requested")
        void onlyWhenRequested() {
            InMemoryKnowledgeGraphStore store = new InMemoryKnowledgeGraphStore();
            store.save(entity("Machine learning", NodeType.CONCEPT, null, 0.5));

            ExploreResult without = orchestrator(store)
                    .explore(ExploreRequest.builder(USER).textMatch("machine").build());
            ExploreResult with = orchestrator(store)
                    .explore(ExploreRequest.builder(USER).textMatch("machine").returnExplanations(true).build());

            assertTrue(without.getExplanations().isEmpty());
            ExploreExplanations explanations = with.getExplanations().orElseThrow();
            assertEquals(1, explanations.signalHits().get(RetrievalOrchestrator.SIGNAL_FUZZY));
            assertEquals(0, explanations.signalHits().get(RetrievalOrchestrator.SIGNAL_EMBEDDING));
            assertEquals(1, explanations.totalUniqueHits());
        }
    }
}
