package com.knowledge.graph.resolve;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.MatchTier;

import java.util.Objects;

/**
 * A confident match produced by one resolver tier.
 */
public record StrategyMatch(Entity entity, double confidence, MatchTier tier) {

    public StrategyMatch {
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(tier, "tier is required");
    }
}
