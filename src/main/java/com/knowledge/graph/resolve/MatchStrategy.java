package com.knowledge.graph.resolve;

import java.util.Optional;

/**
 * One resolver tier. Tiers run in order of increasing cost and the first match wins,
 * so a strategy must not be consulted once an earlier one matched.
 */
public interface MatchStrategy {

    /**
     * @return a confident match, or empty to fall through to the next tier
     * @throws com.knowledge.graph.graph.GraphStoreException if the store fails; a failed
     *         lookup is never reported as "no match"
     */
    Optional<StrategyMatch> tryMatch(ResolutionContext context);

    String getName();
}
