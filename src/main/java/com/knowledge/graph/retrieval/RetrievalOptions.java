package com.knowledge.graph.retrieval;

import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.fusion.FusionConstants;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables for explore. The per-type caps also fix the order in which selected nodes
 * are concatenated: Concept, Entity, Person, Source.
 */
public class RetrievalOptions {

    public static final int DEFAULT_TOP_K = 50;
    public static final double DEFAULT_RELATIONSHIP_SCORE = 0.7;
    public static final int DEFAULT_MAX_EDGES = 10;
    public static final Duration DEFAULT_SIGNAL_TIMEOUT = Duration.ofSeconds(5);

    private final int k;
    private final int topK;
    private final Map<NodeType, Integer> typeCaps;
    private final double relationshipScore;
    private final int maxEdges;
    private final Duration signalTimeout;
    private final boolean recordAccess;

    private RetrievalOptions(Builder builder) {
        this.k = builder.k;
        this.topK = builder.topK;
        this.typeCaps = Collections.unmodifiableMap(new LinkedHashMap<>(builder.typeCaps));
        this.relationshipScore = builder.relationshipScore;
        this.maxEdges = builder.maxEdges;
        this.signalTimeout = builder.signalTimeout;
        this.recordAccess = builder.recordAccess;
    }

    public int getK() {
        return k;
    }

    public int getTopK() {
        return topK;
    }

    /**
     * Selection caps in concatenation order.
     */
    public Map<NodeType, Integer> getTypeCaps() {
        return typeCaps;
    }

    public double getRelationshipScore() {
        return relationshipScore;
    }

    public int getMaxEdges() {
        return maxEdges;
    }

    public Duration getSignalTimeout() {
        return signalTimeout;
    }

    /**
     * Whether the selected seed nodes are counted as accessed after each explore.
     */
    public boolean isRecordAccess() {
        return recordAccess;
    }

    public static RetrievalOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int k = FusionConstants.DEFAULT_K;
        private int topK = DEFAULT_TOP_K;
        private final Map<NodeType, Integer> typeCaps = new LinkedHashMap<>();
        private double relationshipScore = DEFAULT_RELATIONSHIP_SCORE;
        private int maxEdges = DEFAULT_MAX_EDGES;
        private Duration signalTimeout = DEFAULT_SIGNAL_TIMEOUT;
        private boolean recordAccess = true;

        private Builder() {
            typeCaps.put(NodeType.CONCEPT, 5);
            typeCaps.put(NodeType.NAMED_ENTITY, 3);
            typeCaps.put(NodeType.PERSON, 3);
            typeCaps.put(NodeType.SOURCE, 5);
        }

        public Builder k(int k) {
            if (k <= 0) {
                throw new IllegalArgumentException("k must be positive");
            }
            this.k = k;
            return this;
        }

        public Builder topK(int topK) {
            if (topK <= 0) {
                throw new IllegalArgumentException("topK must be positive");
            }
            this.topK = topK;
            return this;
        }

        public Builder typeCap(NodeType type, int cap) {
            if (cap < 0) {
                throw new IllegalArgumentException("cap must be >= 0");
            }
            typeCaps.put(type, cap);
            return this;
        }

        public Builder relationshipScore(double relationshipScore) {
            if (relationshipScore < 0.0 || relationshipScore > 1.0) {
                throw new IllegalArgumentException("relationshipScore must be between 0.0 and 1.0");
            }
            this.relationshipScore = relationshipScore;
            return this;
        }

        public Builder maxEdges(int maxEdges) {
            if (maxEdges < 0) {
                throw new IllegalArgumentException("maxEdges must be >= 0");
            }
            this.maxEdges = maxEdges;
            return this;
        }

        public Builder signalTimeout(Duration signalTimeout) {
            if (signalTimeout == null || signalTimeout.isNegative() || signalTimeout.isZero()) {
                throw new IllegalArgumentException("signalTimeout must be positive");
            }
            this.signalTimeout = signalTimeout;
            return this;
        }

        public Builder recordAccess(boolean recordAccess) {
            this.recordAccess = recordAccess;
            return this;
        }

        public RetrievalOptions build() {
            return new RetrievalOptions(this);
        }
    }
}
