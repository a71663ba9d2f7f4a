package com.knowledge.graph.metrics;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.NodeType;

import java.time.Duration;

/**
 * Records resolution and retrieval metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a
 * metrics backend on the classpath.
 */
public interface MetricsService {

    void recordResolution(NodeType type, MatchTier tier, Duration duration);

    void incrementEntityCreated(NodeType type);

    void incrementAliasRecorded(NodeType type);

    void incrementDisambiguation(boolean confirmed);

    void incrementSignalFailure(String signal);

    void recordExploreDuration(Duration duration);

    void recordFusedCandidates(int count);

    void recordAccessBatchSize(int size);
}
