package com.knowledge.graph.fusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal Rank Fusion over any number of independently ranked signals.
 *
 * <p>For each id present in at least one signal, {@code rrfScore = Σ 1/(k + rank)}
 * over the signals containing it, with rank 1 for the first element. Metadata comes
 * from the first signal (in input order) that contains the id. Results are sorted by
 * score descending; ties keep first-seen order.</p>
 *
 * <p>Each result also carries a similarity in [0, 1]. When one or more boost rules
 * are satisfied the highest {@code minSimilarity} among them wins; otherwise the
 * score is mapped linearly from [{@value FusionConstants#MIN_RRF},
 * {@value FusionConstants#MAX_RRF}] onto [{@value FusionConstants#TARGET_MIN_SIMILARITY},
 * {@value FusionConstants#TARGET_MAX_SIMILARITY}] and clamped.</p>
 */
public final class ReciprocalRankFusion {
    private static final Logger log = LoggerFactory.getLogger(ReciprocalRankFusion.class);

    private ReciprocalRankFusion() {
    }

    public static <T> List<RrfResult<T>> combine(List<RankingSignal<T>> signals, int topK) {
        return combine(signals, FusionConstants.DEFAULT_K, topK, List.of());
    }

    public static <T> List<RrfResult<T>> combine(List<RankingSignal<T>> signals, int k, int topK,
                                                 List<SignalBoost> boosts) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0");
        }

        // id -> (signal name -> rank)
        Map<String, Map<String, Integer>> ranksById = new LinkedHashMap<>();
        Map<String, T> dataById = new HashMap<>();

        for (RankingSignal<T> signal : signals) {
            Set<String> seenInSignal = new LinkedHashSet<>();
            int rank = 0;
            for (RankedCandidate<T> candidate : signal.candidates()) {
                rank++;
                if (!seenInSignal.add(candidate.id())) {
                    continue;
                }
                ranksById.computeIfAbsent(candidate.id(), id -> new LinkedHashMap<>())
                        .put(signal.name(), rank);
                dataById.putIfAbsent(candidate.id(), candidate.data());
            }
        }

        List<RrfResult<T>> results = new ArrayList<>(ranksById.size());
        for (Map.Entry<String, Map<String, Integer>> entry : ranksById.entrySet()) {
            Map<String, Integer> ranks = entry.getValue();
            double rrfScore = 0.0;
            for (int rank : ranks.values()) {
                rrfScore += 1.0 / (k + rank);
            }
            List<String> matched = new ArrayList<>(ranks.keySet());
            double similarity = similarity(rrfScore, new LinkedHashSet<>(matched), boosts);
            results.add(new RrfResult<>(entry.getKey(), dataById.get(entry.getKey()),
                    rrfScore, similarity, matched, ranks));
        }

        // List.sort is stable, so equal scores keep first-seen order
        results.sort(Comparator.comparingDouble((RrfResult<T> r) -> r.rrfScore()).reversed());

        log.trace("rrf.combined signals={} candidates={} topK={}", signals.size(), results.size(), topK);
        return results.size() > topK ? List.copyOf(results.subList(0, topK)) : results;
    }

    static double similarity(double rrfScore, Set<String> matchedSignals, List<SignalBoost> boosts) {
        double boosted = -1.0;
        for (SignalBoost boost : boosts) {
            if (boost.isSatisfiedBy(matchedSignals)) {
                boosted = Math.max(boosted, boost.minSimilarity());
            }
        }
        if (boosted >= 0.0) {
            return boosted;
        }
        return interpolate(rrfScore);
    }

    static double interpolate(double rrfScore) {
        double normalized = (rrfScore - FusionConstants.MIN_RRF)
                / (FusionConstants.MAX_RRF - FusionConstants.MIN_RRF);
        double similarity = FusionConstants.TARGET_MIN_SIMILARITY
                + normalized * (FusionConstants.TARGET_MAX_SIMILARITY - FusionConstants.TARGET_MIN_SIMILARITY);
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
