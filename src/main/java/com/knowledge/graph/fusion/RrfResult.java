package com.knowledge.graph.fusion;

import java.util.List;
import java.util.Map;

/**
 * A fused candidate.
 *
 * @param rrfScore       sum of 1/(k + rank) over contributing signals
 * @param similarity     interpretable score in [0, 1]; not comparable across calls
 *                       that fuse different signal sets
 * @param matchedSignals names of contributing signals, in input order
 * @param signalRanks    rank of the candidate in each contributing signal
 */
public record RrfResult<T>(
        String id,
        T data,
        double rrfScore,
        double similarity,
        List<String> matchedSignals,
        Map<String, Integer> signalRanks
) {
    public RrfResult {
        matchedSignals = List.copyOf(matchedSignals);
        signalRanks = Map.copyOf(signalRanks);
    }

    public boolean matchedBy(String signalName) {
        return signalRanks.containsKey(signalName);
    }
}
