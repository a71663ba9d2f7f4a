package com.knowledge.graph.similarity;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores how well free text matches a node name, for the fuzzy text signal.
 *
 * <ul>
 *   <li>identical (case-insensitive): 1.0</li>
 *   <li>one contains the other: 0.7 + 0.3 * shorter / longer</li>
 *   <li>shared tokens: up to 0.6, proportional to overlap</li>
 * </ul>
 * Scores below {@link #MIN_SCORE} count as no match.
 */
public class TextMatchScorer implements SimilarityAlgorithm {

    public static final double MIN_SCORE = 0.3;

    private static final double CONTAINMENT_BASE = 0.7;
    private static final double CONTAINMENT_RANGE = 0.3;
    private static final double TOKEN_OVERLAP_CAP = 0.6;

    @Override
    public double compute(String text, String name) {
        if (text == null || name == null) {
            return 0.0;
        }
        String a = text.toLowerCase(Locale.ROOT).trim();
        String b = name.toLowerCase(Locale.ROOT).trim();
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.contains(b) || b.contains(a)) {
            double ratio = (double) Math.min(a.length(), b.length()) / Math.max(a.length(), b.length());
            return CONTAINMENT_BASE + CONTAINMENT_RANGE * ratio;
        }

        Set<String> tokensA = tokens(a);
        Set<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(tokensA);
        common.retainAll(tokensB);
        return TOKEN_OVERLAP_CAP * common.size() / Math.max(tokensA.size(), tokensB.size());
    }

    @Override
    public String getName() {
        return "TextMatch";
    }

    public boolean isMatch(double score) {
        return score >= MIN_SCORE;
    }

    private static Set<String> tokens(String s) {
        return Arrays.stream(s.split("[^\\p{L}\\p{N}]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
