package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.MatchTier;
import com.knowledge.graph.graph.KnowledgeGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tier 3: a previously recorded alias for (normalized name, type, user).
 */
public class AliasStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(AliasStrategy.class);

    private final KnowledgeGraphStore store;

    public AliasStrategy(KnowledgeGraphStore store) {
        this.store = store;
    }

    @Override
    public Optional<StrategyMatch> tryMatch(ResolutionContext context) {
        return store.findAlias(context.normalizedName(), context.mention().type(), context.mention().userId())
                .flatMap(alias -> {
                    Optional<StrategyMatch> match = store.findByEntityKey(alias.entityKey())
                            .map(entity -> new StrategyMatch(entity, ResolutionConfidence.ALIAS, MatchTier.ALIAS));
                    if (match.isEmpty()) {
                        log.warn("alias.dangling normalizedName='{}' entityKey={}",
                                alias.normalizedName(), alias.entityKey());
                    }
                    return match;
                });
    }

    @Override
    public String getName() {
        return "alias";
    }
}
