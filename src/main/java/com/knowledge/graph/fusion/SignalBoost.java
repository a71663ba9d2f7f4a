package com.knowledge.graph.fusion;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Sets a floor on the fused similarity of a candidate when all required signals matched it.
 *
 * @param requiredSignals signal names that must all have contributed
 * @param minSimilarity   similarity floor applied when the rule is satisfied
 * @param description     human-readable label
 */
public record SignalBoost(Set<String> requiredSignals, double minSimilarity, String description) {

    public static final String EXACT_MATCH = "exact_match";
    public static final String FUZZY_MATCH = "fuzzy_match";
    public static final String EMBEDDING = "embedding";

    public static final SignalBoost EXACT = new SignalBoost(
            Set.of(EXACT_MATCH), 0.9, "Exact name match");
    public static final SignalBoost FUZZY_AND_EMBEDDING = new SignalBoost(
            Set.of(FUZZY_MATCH, EMBEDDING), 0.7, "Fuzzy and embedding agree");
    public static final SignalBoost FUZZY_ONLY = new SignalBoost(
            Set.of(FUZZY_MATCH), 0.6, "Fuzzy match");

    /** Boost rules commonly applied to name-resolution candidates. */
    public static final List<SignalBoost> COMMON = List.of(EXACT, FUZZY_AND_EMBEDDING, FUZZY_ONLY);

    public SignalBoost {
        Objects.requireNonNull(requiredSignals, "requiredSignals is required");
        if (requiredSignals.isEmpty()) {
            throw new IllegalArgumentException("A boost needs at least one required signal");
        }
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be between 0.0 and 1.0");
        }
        requiredSignals = Set.copyOf(requiredSignals);
    }

    public boolean isSatisfiedBy(Set<String> matchedSignals) {
        return matchedSignals.containsAll(requiredSignals);
    }
}
