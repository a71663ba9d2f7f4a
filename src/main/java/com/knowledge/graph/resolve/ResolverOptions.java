package com.knowledge.graph.resolve;

import java.time.Duration;

/**
 * Tunables for mention resolution.
 *
 * <p>The 0.92 / 0.85 vector thresholds were chosen empirically and are kept as
 * defaults for behavioral parity; they are not structural invariants.</p>
 */
public class ResolverOptions {

    public static final double DEFAULT_AUTO_RESOLVE_THRESHOLD = 0.92;
    public static final double DEFAULT_DISAMBIGUATION_THRESHOLD = 0.85;
    public static final int DEFAULT_VECTOR_SEARCH_LIMIT = 20;
    public static final int DEFAULT_DISAMBIGUATION_TOP_K = 5;
    public static final double DEFAULT_FUZZY_EDIT_THRESHOLD = 0.9;
    public static final int DEFAULT_FUZZY_CANDIDATE_LIMIT = 500;
    public static final int DEFAULT_MIN_CONTAINMENT_LENGTH = 3;
    public static final Duration DEFAULT_EMBEDDING_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DISAMBIGUATION_TIMEOUT = Duration.ofSeconds(30);

    private final double autoResolveThreshold;
    private final double disambiguationThreshold;
    private final int vectorSearchLimit;
    private final int disambiguationTopK;
    private final double fuzzyEditThreshold;
    private final int fuzzyCandidateLimit;
    private final int minContainmentLength;
    private final boolean embedMissingMentions;
    private final Duration embeddingTimeout;
    private final Duration disambiguationTimeout;

    private ResolverOptions(Builder builder) {
        this.autoResolveThreshold = builder.autoResolveThreshold;
        this.disambiguationThreshold = builder.disambiguationThreshold;
        this.vectorSearchLimit = builder.vectorSearchLimit;
        this.disambiguationTopK = builder.disambiguationTopK;
        this.fuzzyEditThreshold = builder.fuzzyEditThreshold;
        this.fuzzyCandidateLimit = builder.fuzzyCandidateLimit;
        this.minContainmentLength = builder.minContainmentLength;
        this.embedMissingMentions = builder.embedMissingMentions;
        this.embeddingTimeout = builder.embeddingTimeout;
        this.disambiguationTimeout = builder.disambiguationTimeout;
    }

    public double getAutoResolveThreshold() {
        return autoResolveThreshold;
    }

    public double getDisambiguationThreshold() {
        return disambiguationThreshold;
    }

    public int getVectorSearchLimit() {
        return vectorSearchLimit;
    }

    public int getDisambiguationTopK() {
        return disambiguationTopK;
    }

    public double getFuzzyEditThreshold() {
        return fuzzyEditThreshold;
    }

    public int getFuzzyCandidateLimit() {
        return fuzzyCandidateLimit;
    }

    public int getMinContainmentLength() {
        return minContainmentLength;
    }

    /**
     * Whether mentions without an embedding are embedded before the vector tier.
     */
    public boolean isEmbedMissingMentions() {
        return embedMissingMentions;
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public Duration getDisambiguationTimeout() {
        return disambiguationTimeout;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double autoResolveThreshold = DEFAULT_AUTO_RESOLVE_THRESHOLD;
        private double disambiguationThreshold = DEFAULT_DISAMBIGUATION_THRESHOLD;
        private int vectorSearchLimit = DEFAULT_VECTOR_SEARCH_LIMIT;
        private int disambiguationTopK = DEFAULT_DISAMBIGUATION_TOP_K;
        private double fuzzyEditThreshold = DEFAULT_FUZZY_EDIT_THRESHOLD;
        private int fuzzyCandidateLimit = DEFAULT_FUZZY_CANDIDATE_LIMIT;
        private int minContainmentLength = DEFAULT_MIN_CONTAINMENT_LENGTH;
        private boolean embedMissingMentions = true;
        private Duration embeddingTimeout = DEFAULT_EMBEDDING_TIMEOUT;
        private Duration disambiguationTimeout = DEFAULT_DISAMBIGUATION_TIMEOUT;

        public Builder autoResolveThreshold(double autoResolveThreshold) {
            validateThreshold(autoResolveThreshold, "autoResolveThreshold");
            this.autoResolveThreshold = autoResolveThreshold;
            return this;
        }

        public Builder disambiguationThreshold(double disambiguationThreshold) {
            validateThreshold(disambiguationThreshold, "disambiguationThreshold");
            this.disambiguationThreshold = disambiguationThreshold;
            return this;
        }

        public Builder vectorSearchLimit(int vectorSearchLimit) {
            validatePositive(vectorSearchLimit, "vectorSearchLimit");
            this.vectorSearchLimit = vectorSearchLimit;
            return this;
        }

        public Builder disambiguationTopK(int disambiguationTopK) {
            validatePositive(disambiguationTopK, "disambiguationTopK");
            this.disambiguationTopK = disambiguationTopK;
            return this;
        }

        public Builder fuzzyEditThreshold(double fuzzyEditThreshold) {
            validateThreshold(fuzzyEditThreshold, "fuzzyEditThreshold");
            this.fuzzyEditThreshold = fuzzyEditThreshold;
            return this;
        }

        public Builder fuzzyCandidateLimit(int fuzzyCandidateLimit) {
            validatePositive(fuzzyCandidateLimit, "fuzzyCandidateLimit");
            this.fuzzyCandidateLimit = fuzzyCandidateLimit;
            return this;
        }

        public Builder minContainmentLength(int minContainmentLength) {
            validatePositive(minContainmentLength, "minContainmentLength");
            this.minContainmentLength = minContainmentLength;
            return this;
        }

        public Builder embedMissingMentions(boolean embedMissingMentions) {
            this.embedMissingMentions = embedMissingMentions;
            return this;
        }

        public Builder embeddingTimeout(Duration embeddingTimeout) {
            this.embeddingTimeout = requirePositive(embeddingTimeout, "embeddingTimeout");
            return this;
        }

        public Builder disambiguationTimeout(Duration disambiguationTimeout) {
            this.disambiguationTimeout = requirePositive(disambiguationTimeout, "disambiguationTimeout");
            return this;
        }

        public ResolverOptions build() {
            if (autoResolveThreshold < disambiguationThreshold) {
                throw new IllegalArgumentException(
                        "autoResolveThreshold must be >= disambiguationThreshold");
            }
            return new ResolverOptions(this);
        }

        private static void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private static void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return value;
        }
    }
}
