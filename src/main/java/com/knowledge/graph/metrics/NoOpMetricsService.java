package com.knowledge.graph.metrics;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.NodeType;

import java.time.Duration;

/**
 * {@link MetricsService} that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(NodeType type, MatchTier tier, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(NodeType type) {
    }

    @Override
    public void incrementAliasRecorded(NodeType type) {
    }

    @Override
    public void incrementDisambiguation(boolean confirmed) {
    }

    @Override
    public void incrementSignalFailure(String signal) {
    }

    @Override
    public void recordExploreDuration(Duration duration) {
    }

    @Override
    public void recordFusedCandidates(int count) {
    }

    @Override
    public void recordAccessBatchSize(int size) {
    }
}
