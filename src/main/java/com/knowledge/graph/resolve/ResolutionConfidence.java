package com.knowledge.graph.resolve;

/**
 * Confidence assigned by each resolver tier.
 */
public final class ResolutionConfidence {

    public static final double EXACT_KEY = 0.95;
    public static final double CANONICAL_NAME = 0.95;
    public static final double ALIAS = 0.95;
    public static final double FUZZY_CONTAINMENT = 0.95;
    public static final double DISAMBIGUATED = 0.88;
    public static final double CREATED = 0.8;

    /** Auto-resolved vector matches are scaled into [VECTOR_MIN, VECTOR_MAX]. */
    public static final double VECTOR_MIN = 0.92;
    public static final double VECTOR_MAX = 0.96;

    private ResolutionConfidence() {
    }

    /**
     * Maps a similarity above the auto-resolve threshold linearly onto
     * [{@link #VECTOR_MIN}, {@link #VECTOR_MAX}].
     */
    public static double scaleVector(double similarity, double autoResolveThreshold) {
        double span = 1.0 - autoResolveThreshold;
        double position = span <= 0.0 ? 1.0 : (similarity - autoResolveThreshold) / span;
        position = Math.max(0.0, Math.min(1.0, position));
        return VECTOR_MIN + position * (VECTOR_MAX - VECTOR_MIN);
    }
}
