package com.knowledge.graph.core.model;

/**
 * The resolver tier that produced a resolution.
 */
public enum MatchTier {
    EXACT_KEY,
    CANONICAL_NAME,
    ALIAS,
    VECTOR,
    DISAMBIGUATED,
    FUZZY_TEXT,
    CREATED
}
