package com.knowledge.graph.fusion;

import java.util.Objects;

/**
 * One scored entry of a ranking signal.
 *
 * @param id    stable identifier used to join entries across signals
 * @param score signal-local score; only its order within the signal matters to fusion
 * @param data  payload carried through to the fused result
 */
public record RankedCandidate<T>(String id, double score, T data) {

    public RankedCandidate {
        Objects.requireNonNull(id, "id is required");
    }
}
