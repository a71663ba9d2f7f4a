package com.knowledge.graph.metrics;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.NodeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolution(NodeType.PERSON, MatchTier.EXACT_KEY, Duration.ofMillis(3));
                noOp.incrementEntityCreated(NodeType.CONCEPT);
                noOp.incrementAliasRecorded(NodeType.CONCEPT);
                noOp.incrementDisambiguation(true);
                noOp.incrementSignalFailure("embedding");
                noOp.recordExploreDuration(Duration.ofMillis(40));
                noOp.recordFusedCandidates(12);
                noOp.recordAccessBatchSize(4);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Resolution duration is tagged by node type and tier")
        void recordResolution() {
            metrics.recordResolution(NodeType.PERSON, MatchTier.ALIAS, Duration.ofMillis(150));
            metrics.recordResolution(NodeType.PERSON, MatchTier.ALIAS, Duration.ofMillis(250));
            metrics.recordResolution(NodeType.CONCEPT, MatchTier.CREATED, Duration.ofMillis(10));

            Timer timer = registry.find("knowledge.resolution.duration")
                    .tag("nodeType", "PERSON")
                    .tag("tier", "ALIAS")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
        }

        @Test
        @DisplayName("Counters are tagged and accumulate")
        void counters() {
            metrics.incrementEntityCreated(NodeType.CONCEPT);
            metrics.incrementEntityCreated(NodeType.CONCEPT);
            metrics.incrementAliasRecorded(NodeType.PERSON);
            metrics.incrementDisambiguation(false);
            metrics.incrementSignalFailure("fuzzy_match");

            Counter created = registry.find("knowledge.entity.created").tag("nodeType", "CONCEPT").counter();
            Counter rejected = registry.find("knowledge.disambiguation").tag("outcome", "rejected").counter();
            Counter failure = registry.find("knowledge.explore.signal.failure").tag("signal", "fuzzy_match").counter();

            assertEquals(2.0, created.count());
            assertEquals(1.0, registry.find("knowledge.alias.recorded").counter().count());
            assertEquals(1.0, rejected.count());
            assertNull(registry.find("knowledge.disambiguation").tag("outcome", "confirmed").counter());
            assertEquals(1.0, failure.count());
        }

        @Test
        @DisplayName("Explore metrics are recorded")
        void exploreMetrics() {
            metrics.recordExploreDuration(Duration.ofMillis(80));
            metrics.recordFusedCandidates(17);
            metrics.recordAccessBatchSize(5);

            assertEquals(1, registry.find("knowledge.explore.duration").timer().count());
            DistributionSummary fused = registry.find("knowledge.explore.fused").summary();
            assertEquals(17.0, fused.totalAmount());
            assertEquals(5.0, registry.find("knowledge.access.batch.size").summary().max());
        }
    }
}
