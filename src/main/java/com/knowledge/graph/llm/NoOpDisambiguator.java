package com.knowledge.graph.llm;

/**
 * Rejects every request. Used when no language model is configured, which makes
 * ambiguous vector matches fall through to later tiers.
 */
public class NoOpDisambiguator implements Disambiguator {

    @Override
    public DisambiguationResult disambiguate(DisambiguationRequest request) {
        return DisambiguationResult.rejected("No disambiguator configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
