package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.graph.KnowledgeGraphStore;

import java.util.Optional;

/**
 * Tier 1: a node already holds the mention's entity key.
 */
public class ExactKeyStrategy implements MatchStrategy {

    private final KnowledgeGraphStore store;

    public ExactKeyStrategy(KnowledgeGraphStore store) {
        this.store = store;
    }

    @Override
    public Optional<StrategyMatch> tryMatch(ResolutionContext context) {
        return store.findByEntityKey(context.entityKey())
                .map(entity -> {
                    context.verifyOwnership(entity);
                    return new StrategyMatch(entity, ResolutionConfidence.EXACT_KEY, MatchTier.EXACT_KEY);
                });
    }

    @Override
    public String getName() {
        return "exact_key";
    }
}
