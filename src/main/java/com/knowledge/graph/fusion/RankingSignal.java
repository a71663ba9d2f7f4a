package com.knowledge.graph.fusion;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named, ordered list of candidates from one independent source. The first
 * element has rank 1.
 */
public record RankingSignal<T>(String name, List<RankedCandidate<T>> candidates) {

    public RankingSignal {
        Objects.requireNonNull(name, "name is required");
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static <T> RankingSignal<T> empty(String name) {
        return new RankingSignal<>(name, List.of());
    }

    /**
     * Builds a signal ordered by score, highest first. Ties keep their input order.
     */
    public static <T> RankingSignal<T> sortedByScore(String name, List<RankedCandidate<T>> candidates) {
        List<RankedCandidate<T>> sorted = candidates.stream()
                .sorted(Comparator.comparingDouble((RankedCandidate<T> c) -> c.score()).reversed())
                .toList();
        return new RankingSignal<>(name, sorted);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }
}
