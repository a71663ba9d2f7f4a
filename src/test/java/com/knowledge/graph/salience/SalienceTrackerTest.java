package com.knowledge.graph.salience;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.EntityState;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.graph.InMemoryKnowledgeGraphStore;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.metrics.MetricsService;
import com.knowledge.graph.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("SalienceTracker Tests")
class SalienceTrackerTest {

    private InMemoryKnowledgeGraphStore store;
    private SalienceTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryKnowledgeGraphStore();
        tracker = new SalienceTracker(store, new NoOpMetricsService());
        store.save(entity("k1"));
        store.save(entity("k2"));
    }

    private static Entity entity(String key) {
        return Entity.builder()
                .entityKey(key)
                .userId("u1")
                .type(NodeType.CONCEPT)
                .name(key)
                .build();
    }

    @Nested
    @DisplayName("Access")
    class Access {

        @Test
        @DisplayName("First access promotes candidate to active and raises salience")
        void firstAccess() {
            tracker.incrementAccess("k1");

            Entity e = store.findByEntityKey("k1").orElseThrow();
            assertEquals(EntityState.ACTIVE, e.getState());
            assertEquals(1, e.getAccessCount());
            assertEquals(1, e.getRecallFrequency());
            assertEquals(0.575, e.getSalience(), 1e-9);
            assertNotNull(e.getLastAccessedAt());
        }

        @Test
        @DisplayName("Ten accesses reach core and salience never exceeds 1.0")
        void tenAccessesReachCore() {
            for (int i = 0; i < 10; i++) {
                tracker.incrementAccess("k1");
            }
            Entity e = store.findByEntityKey("k1").orElseThrow();
            assertEquals(EntityState.CORE, e.getState());
            assertEquals(1.0, e.getSalience(), 1e-9);

            for (int i = 0; i < 5; i++) {
                tracker.incrementAccess("k1");
            }
            assertEquals(1.0, store.findByEntityKey("k1").orElseThrow().getSalience(), 1e-9);
        }

        @Test
        @DisplayName("Nine accesses stay active")
        void nineAccessesStayActive() {
            for (int i = 0; i < 9; i++) {
                tracker.incrementAccess("k1");
            }
            assertEquals(EntityState.ACTIVE, store.findByEntityKey("k1").orElseThrow().getState());
        }
    }

    @Nested
    @DisplayName("Batch access")
    class BatchAccess {

        @Test
        @DisplayName("Batch is one store call with distinct keys")
        void singleStoreCall() {
            KnowledgeGraphStore mockStore = mock(KnowledgeGraphStore.class);
            MetricsService metrics = mock(MetricsService.class);
            SalienceTracker mocked = new SalienceTracker(mockStore, metrics);

            mocked.batchIncrementAccess(List.of("a", "b", "a"));

            verify(mockStore, times(1)).applySalienceUpdate(eq(Set.of("a", "b")), eq(SalienceUpdate.access()));
            verify(metrics).recordAccessBatchSize(2);
        }

        @Test
        @DisplayName("Empty batch does not touch the store")
        void emptyBatch() {
            KnowledgeGraphStore mockStore = mock(KnowledgeGraphStore.class);
            new SalienceTracker(mockStore, new NoOpMetricsService()).batchIncrementAccess(List.of());
            verifyNoInteractions(mockStore);
        }

        @Test
        @DisplayName("Batch updates every node")
        void updatesEveryNode() {
            tracker.batchIncrementAccess(List.of("k1", "k2"));
            assertEquals(1, store.findByEntityKey("k1").orElseThrow().getAccessCount());
            assertEquals(1, store.findByEntityKey("k2").orElseThrow().getAccessCount());
        }
    }

    @Nested
    @DisplayName("Adjustment")
    class Adjustment {

        @Test
        @DisplayName("Negative delta decays salience without counting an access")
        void decay() {
            tracker.applyDelta("k1", -0.2);
            Entity e = store.findByEntityKey("k1").orElseThrow();
            assertEquals(0.3, e.getSalience(), 1e-9);
            assertEquals(0, e.getAccessCount());
            assertEquals(EntityState.CANDIDATE, e.getState());
        }

        @Test
        @DisplayName("Salience is clamped at zero")
        void clampedAtZero() {
            tracker.applyDelta("k1", -1.0);
            assertEquals(0.0, tracker.currentSalience(List.of("k1")).get("k1"), 1e-9);
        }

        @Test
        @DisplayName("Unknown keys are absent from current salience")
        void unknownKeysAbsent() {
            assertFalse(tracker.currentSalience(List.of("missing")).containsKey("missing"));
            assertTrue(tracker.currentSalience("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("SalienceRules")
    class Rules {

        @Test
        @DisplayName("State never regresses")
        void neverRegresses() {
            assertEquals(EntityState.CORE, SalienceRules.nextState(EntityState.CORE, 1));
        }

        @Test
        @DisplayName("Adjustment leaves counters and state unchanged")
        void adjustmentLeavesCounters() {
            Entity current = entity("k").toBuilder().accessCount(3).state(EntityState.ACTIVE).build();
            Entity next = SalienceRules.apply(current, SalienceUpdate.adjust(0.1), Instant.EPOCH);
            assertEquals(3, next.getAccessCount());
            assertEquals(EntityState.ACTIVE, next.getState());
            assertEquals(0.6, next.getSalience(), 1e-9);
        }

        @Test
        @DisplayName("Deltas outside [-1, 1] are rejected")
        void invalidDelta() {
            assertThrows(IllegalArgumentException.class, () -> SalienceUpdate.adjust(1.5));
        }
    }
}
