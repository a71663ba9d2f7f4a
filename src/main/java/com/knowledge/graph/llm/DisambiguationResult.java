package com.knowledge.graph.llm;

/**
 * Verdict of a disambiguator.
 *
 * @param matchedEntityKey key of the confirmed match, or null when all were rejected
 * @param confidence       disambiguator's own confidence in [0, 1]
 * @param reasoning        free-text explanation, may be null
 */
public record DisambiguationResult(String matchedEntityKey, double confidence, String reasoning) {

    public DisambiguationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public static DisambiguationResult rejected(String reasoning) {
        return new DisambiguationResult(null, 0.0, reasoning);
    }

    public static DisambiguationResult confirmed(String entityKey, double confidence, String reasoning) {
        return new DisambiguationResult(entityKey, confidence, reasoning);
    }

    public boolean isMatch() {
        return matchedEntityKey != null;
    }
}
