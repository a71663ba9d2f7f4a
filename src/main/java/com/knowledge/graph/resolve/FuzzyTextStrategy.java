package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.normalization.EntityNameNormalizer;
import com.knowledge.graph.similarity.EditDistanceSimilarity;
import com.knowledge.graph.similarity.SimilarityAlgorithm;

import java.util.Comparator;
import java.util.Optional;

/**
 * Tier 5: text similarity on normalized names.
 *
 * <p>A whole-word containment either way ("acme" within "acme corp") resolves with
 * confidence 0.95. Failing that, the closest name by edit distance resolves when its
 * similarity reaches the configured threshold, with that similarity (at most 0.95) as
 * confidence.</p>
 */
public class FuzzyTextStrategy implements MatchStrategy {

    private final KnowledgeGraphStore store;
    private final ResolverOptions options;
    private final SimilarityAlgorithm editDistance = new EditDistanceSimilarity();

    public FuzzyTextStrategy(KnowledgeGraphStore store, ResolverOptions options) {
        this.store = store;
        this.options = options;
    }

    @Override
    public Optional<StrategyMatch> tryMatch(ResolutionContext context) {
        String normalized = context.normalizedName();
        if (normalized.length() < options.getMinContainmentLength()) {
            return Optional.empty();
        }

        Optional<StrategyMatch> containment = store.findByNormalizedNameContainment(
                        normalized, context.mention().type(), context.mention().userId())
                .stream()
                .filter(e -> isWholeWordContainment(normalized, e.getNormalizedName()))
                .max(Comparator.comparingDouble(e -> overlapRatio(normalized, e.getNormalizedName())))
                .map(e -> new StrategyMatch(e, ResolutionConfidence.FUZZY_CONTAINMENT, MatchTier.FUZZY_TEXT));
        if (containment.isPresent()) {
            return containment;
        }

        Entity best = null;
        double bestScore = 0.0;
        for (Entity candidate : store.findFuzzyNameCandidates(normalized, context.mention().type(),
                context.mention().userId(), options.getFuzzyCandidateLimit())) {
            double score = score(normalized, candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best != null && bestScore >= options.getFuzzyEditThreshold()) {
            return Optional.of(new StrategyMatch(best,
                    Math.min(ResolutionConfidence.FUZZY_CONTAINMENT, bestScore), MatchTier.FUZZY_TEXT));
        }
        return Optional.empty();
    }

    private double score(String normalized, Entity candidate) {
        double byName = candidate.getNormalizedName() != null
                ? editDistance.compute(normalized, candidate.getNormalizedName())
                : 0.0;
        double byCanonical = candidate.getCanonicalName() != null
                ? editDistance.compute(normalized, EntityNameNormalizer.normalize(candidate.getCanonicalName()))
                : 0.0;
        return Math.max(byName, byCanonical);
    }

    private boolean isWholeWordContainment(String a, String b) {
        if (b == null || b.isEmpty() || a.equals(b)) {
            return false;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.length() < options.getMinContainmentLength()) {
            return false;
        }
        return (" " + longer + " ").contains(" " + shorter + " ");
    }

    private static double overlapRatio(String a, String b) {
        return (double) Math.min(a.length(), b.length()) / Math.max(a.length(), b.length());
    }

    @Override
    public String getName() {
        return "fuzzy_text";
    }
}
