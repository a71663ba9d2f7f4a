package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.graph.KnowledgeGraphStore;

import java.util.Optional;

/**
 * Tier 2, people only: case-insensitive match on canonical name.
 */
public class PersonCanonicalNameStrategy implements MatchStrategy {

    private final KnowledgeGraphStore store;

    public PersonCanonicalNameStrategy(KnowledgeGraphStore store) {
        this.store = store;
    }

    @Override
    public Optional<StrategyMatch> tryMatch(ResolutionContext context) {
        if (context.mention().type() != NodeType.PERSON) {
            return Optional.empty();
        }
        return store.findPersonByCanonicalName(context.mention().name(), context.mention().userId())
                .map(person -> new StrategyMatch(person, ResolutionConfidence.CANONICAL_NAME,
                        MatchTier.CANONICAL_NAME));
    }

    @Override
    public String getName() {
        return "canonical_name";
    }
}
