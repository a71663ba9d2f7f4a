package com.knowledge.graph.metrics;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.NodeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code knowledge.resolution.duration}: timer (tags nodeType, tier)</li>
 *   <li>{@code knowledge.entity.created}: counter (tag nodeType)</li>
 *   <li>{@code knowledge.alias.recorded}: counter (tag nodeType)</li>
 *   <li>{@code knowledge.disambiguation}: counter (tag outcome)</li>
 *   <li>{@code knowledge.explore.signal.failure}: counter (tag signal)</li>
 *   <li>{@code knowledge.explore.duration}: timer</li>
 *   <li>{@code knowledge.explore.fused}: distribution summary</li>
 *   <li>{@code knowledge.access.batch.size}: distribution summary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer exploreTimer;
    private final DistributionSummary fusedSummary;
    private final DistributionSummary accessBatchSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.exploreTimer = Timer.builder("knowledge.explore.duration")
                .description("Duration of explore calls")
                .register(registry);
        this.fusedSummary = DistributionSummary.builder("knowledge.explore.fused")
                .description("Number of fused candidates per explore call")
                .register(registry);
        this.accessBatchSummary = DistributionSummary.builder("knowledge.access.batch.size")
                .description("Number of nodes per access batch")
                .register(registry);
    }

    @Override
    public void recordResolution(NodeType type, MatchTier tier, Duration duration) {
        String key = type.name() + ":" + tier.name();
        timerCache.computeIfAbsent(key, k ->
                Timer.builder("knowledge.resolution.duration")
                        .description("Duration of mention resolution")
                        .tag("nodeType", type.name())
                        .tag("tier", tier.name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementEntityCreated(NodeType type) {
        counter("knowledge.entity.created", "Number of entities created", "nodeType", type.name()).increment();
    }

    @Override
    public void incrementAliasRecorded(NodeType type) {
        counter("knowledge.alias.recorded", "Number of aliases recorded", "nodeType", type.name()).increment();
    }

    @Override
    public void incrementDisambiguation(boolean confirmed) {
        counter("knowledge.disambiguation", "Number of disambiguation calls", "outcome",
                confirmed ? "confirmed" : "rejected").increment();
    }

    @Override
    public void incrementSignalFailure(String signal) {
        counter("knowledge.explore.signal.failure", "Number of gather signals that failed or timed out",
                "signal", signal).increment();
    }

    @Override
    public void recordExploreDuration(Duration duration) {
        exploreTimer.record(duration);
    }

    @Override
    public void recordFusedCandidates(int count) {
        fusedSummary.record(count);
    }

    @Override
    public void recordAccessBatchSize(int size) {
        accessBatchSummary.record(size);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
