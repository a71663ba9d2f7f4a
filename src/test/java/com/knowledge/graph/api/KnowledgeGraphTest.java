package com.knowledge.graph.api;

import com.knowledge.graph.core.model.Edge;
import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.Mention;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.core.model.Note;
import com.knowledge.graph.core.model.ResolutionResult;
import com.knowledge.graph.core.model.SearchHit;
import com.knowledge.graph.graph.GraphConnection;
import com.knowledge.graph.graph.InMemoryKnowledgeGraphStore;
import com.knowledge.graph.llm.EmbeddingProvider;
import com.knowledge.graph.retrieval.ExploreRequest;
import com.knowledge.graph.retrieval.ExploreResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("KnowledgeGraph Tests")
class KnowledgeGraphTest {

    private static final String USER = "u1";

    private InMemoryKnowledgeGraphStore store;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        store = new InMemoryKnowledgeGraphStore();
        graph = KnowledgeGraph.builder().store(store).workerThreads(2).build();
    }

    @AfterEach
    void tearDown() {
        graph.close();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("A connection or a store is required")
        void requiresBackend() {
            assertThrows(IllegalStateException.class, () -> KnowledgeGraph.builder().build());
            assertThrows(IllegalArgumentException.class, () -> KnowledgeGraph.builder().workerThreads(0));
        }

        @Test
        @DisplayName("A supplied connection gets its indexes and stays open on close")
        void callerOwnedConnection() {
            GraphConnection connection = mock(GraphConnection.class);

            KnowledgeGraph.builder().graphConnection(connection).build().close();

            verify(connection).createIndexes();
            verify(connection, never()).close();
        }

        @Test
        @DisplayName("Index creation can be skipped")
        void skipIndexes() {
            GraphConnection connection = mock(GraphConnection.class);

            KnowledgeGraph.builder().graphConnection(connection).createIndexes(false).build().close();

            verify(connection, never()).createIndexes();
        }

        @Test
        @DisplayName("A caller-owned executor is not shut down")
        void callerOwnedExecutor() {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                KnowledgeGraph.builder().store(new InMemoryKnowledgeGraphStore()).executor(executor).build().close();
                assertFalse(executor.isShutdown());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Resolve then explore")
    class Workflow {

        @Test
        @DisplayName("Repeated mentions land on the same entity")
        void stableKeys() {
            ResolutionResult first = graph.resolve("Machine learning", NodeType.CONCEPT, USER);
            ResolutionResult again = graph.resolve("machine  learning", NodeType.CONCEPT, USER);

            assertTrue(first.isNew());
            assertFalse(again.isNew());
            assertEquals(MatchTier.EXACT_KEY, again.tier());
            assertEquals(first.entityKey(), again.entityKey());
            assertEquals(1, store.nodeCount());
        }

        @Test
        @DisplayName("Resolved entities are found by explore and gain salience")
        void exploreFindsResolved() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);

            ExploreResult result = graph.explore(ExploreRequest.builder(USER).textMatch("machine learning").build());

            assertEquals(List.of(ml.entityKey()), result.seeds().stream().map(s -> s.entityKey()).toList());
            Entity after = store.findByEntityKey(ml.entityKey()).orElseThrow();
            assertTrue(after.getSalience() > Entity.DEFAULT_SALIENCE);
        }

        @Test
        @DisplayName("Sources link to the entities they mention")
        void recordSource() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);
            ResolutionResult alice = graph.resolve("Alice", NodeType.PERSON, USER);

            ResolutionResult source = graph.recordSource("Weekly sync notes", USER,
                    List.of(ml.entityKey(), alice.entityKey()));

            List<Edge> edges = store.expandGraph(List.of(source.entityKey()), USER).edges();
            assertEquals(2, edges.size());
            assertTrue(edges.stream().allMatch(e -> e.relationshipType().equals(Edge.MENTIONS)
                    && e.fromKey().equals(source.entityKey())));
        }

        @Test
        @DisplayName("Similarly named sources stay separate nodes")
        void similarSourcesAreNotMerged() {
            ResolutionResult first = graph.recordSource("Conversation 2024-01-02", USER, List.of());
            ResolutionResult second = graph.recordSource("Conversation 2024-01-03", USER, List.of());
            ResolutionResult weekly = graph.recordSource("Weekly sync", USER, List.of());
            ResolutionResult followup = graph.recordSource("Weekly sync followup", USER, List.of());

            assertTrue(first.isNew());
            assertTrue(second.isNew());
            assertTrue(followup.isNew());
            assertNotEquals(first.entityKey(), second.entityKey());
            assertNotEquals(weekly.entityKey(), followup.entityKey());
            assertEquals("Conversation 2024-01-03",
                    store.findByEntityKey(second.entityKey()).orElseThrow().getName());
            assertEquals(NodeType.SOURCE, store.findByEntityKey(second.entityKey()).orElseThrow().getType());
        }

        @Test
        @DisplayName("Recording the same source twice reuses its node")
        void sameSourceIsReused() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);

            ResolutionResult first = graph.recordSource("Conversation 2024-01-02", USER, List.of(ml.entityKey()));
            ResolutionResult again = graph.recordSource("Conversation 2024-01-02", USER, List.of(ml.entityKey()));

            assertFalse(again.isNew());
            assertEquals(MatchTier.EXACT_KEY, again.tier());
            assertEquals(first.entityKey(), again.entityKey());
            assertEquals(1, store.expandGraph(List.of(first.entityKey()), USER).edges().size());
        }
    }

    @Nested
    @DisplayName("Mutations")
    class Mutations {

        @Test
        @DisplayName("Notes are appended and oversized notes rejected")
        void appendNote() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);

            graph.appendNote(ml.entityKey(), "covered in week 3", USER);

            assertEquals(List.of("covered in week 3"), store.findByEntityKey(ml.entityKey()).orElseThrow()
                    .getNotes().stream().map(Note::content).toList());
            assertThrows(IllegalArgumentException.class,
                    () -> graph.appendNote(ml.entityKey(), "x".repeat(5000), USER));
        }

        @Test
        @DisplayName("Edge descriptions are embedded for relationship search")
        void edgeDescriptionEmbedded() {
            EmbeddingProvider embedder = mock(EmbeddingProvider.class);
            when(embedder.getProviderName()).thenReturn("Mock");
            when(embedder.embed(anyString())).thenReturn(new float[]{1f, 0f});
            try (KnowledgeGraph embedded = KnowledgeGraph.builder().store(store).embeddingProvider(embedder).build()) {
                String a = embedded.resolve(Mention.of("Alice", NodeType.PERSON, USER)).entityKey();
                String b = embedded.resolve(Mention.of("Graphs", NodeType.CONCEPT, USER)).entityKey();

                embedded.upsertEdge(new Edge(a, b, "STUDIES", null, null, "studies graph theory",
                        List.of(), null, null, null));

                List<SearchHit> hits = store.findNodesViaRelationshipSearch(new float[]{1f, 0f}, 0.7, USER);
                assertEquals(2, hits.size());
            }
        }

        @Test
        @DisplayName("An embedding failure still stores the edge")
        void edgeEmbeddingFailure() {
            EmbeddingProvider embedder = mock(EmbeddingProvider.class);
            when(embedder.getProviderName()).thenReturn("Mock");
            when(embedder.embed(anyString())).thenThrow(new IllegalStateException("model offline"));
            try (KnowledgeGraph embedded = KnowledgeGraph.builder().store(store).embeddingProvider(embedder).build()) {
                String a = embedded.resolve("Alice", NodeType.PERSON, USER).entityKey();
                String b = embedded.resolve("Graphs", NodeType.CONCEPT, USER).entityKey();

                embedded.upsertEdge(new Edge(a, b, "STUDIES", null, null, "studies graph theory",
                        List.of(), null, null, null));

                assertEquals(1, store.expandGraph(List.of(a), USER).edges().size());
            }
        }

        @Test
        @DisplayName("Unsafe relationship types are rejected")
        void unsafeRelationshipType() {
            assertThrows(IllegalArgumentException.class, () -> graph.upsertEdge(
                    new Edge("a", "b", "KNOWS]->(x)", null, null, null, List.of(), null, null, null)));
        }

        @Test
        @DisplayName("Salience adjustments clamp and do not count as access")
        void adjustSalience() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);

            graph.adjustSalience(ml.entityKey(), -0.8);

            Entity after = store.findByEntityKey(ml.entityKey()).orElseThrow();
            assertEquals(0.0, after.getSalience(), 1e-9);
            assertEquals(0, after.getAccessCount());
        }

        @Test
        @DisplayName("Recorded access raises salience")
        void recordAccess() {
            ResolutionResult ml = graph.resolve("Machine learning", NodeType.CONCEPT, USER);

            graph.recordAccess(List.of(ml.entityKey(), ml.entityKey()));

            assertEquals(1, store.findByEntityKey(ml.entityKey()).orElseThrow().getAccessCount());
        }
    }
}
