package com.knowledge.graph.core.model;

import java.util.Objects;

/**
 * Outcome of resolving a mention.
 *
 * @param entityKey   key of the matched or newly created entity
 * @param confidence  confidence in [0, 1]
 * @param isNew       true when the fallback tier created the entity
 * @param tier        tier that produced the match
 * @param matchedName stored name of the resolved entity
 */
public record ResolutionResult(
        String entityKey,
        double confidence,
        boolean isNew,
        MatchTier tier,
        String matchedName
) {
    public ResolutionResult {
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(tier, "tier is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public static ResolutionResult matched(Entity entity, double confidence, MatchTier tier) {
        return new ResolutionResult(entity.getEntityKey(), confidence, false, tier, entity.getName());
    }

    public static ResolutionResult created(Entity entity, double confidence) {
        return new ResolutionResult(entity.getEntityKey(), confidence, true, MatchTier.CREATED, entity.getName());
    }
}
