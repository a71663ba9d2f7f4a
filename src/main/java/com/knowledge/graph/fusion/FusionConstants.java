package com.knowledge.graph.fusion;

/**
 * Tuning constants for reciprocal rank fusion. The interpolation range was chosen
 * empirically; treat these as tunables rather than invariants.
 */
public final class FusionConstants {

    /** Rank damping constant. */
    public static final int DEFAULT_K = 60;

    /** Observed lower end of fused scores. */
    public static final double MIN_RRF = 0.01;

    /** Observed upper end of fused scores. */
    public static final double MAX_RRF = 0.05;

    /** Similarity assigned at {@link #MIN_RRF}. */
    public static final double TARGET_MIN_SIMILARITY = 0.3;

    /** Similarity assigned at {@link #MAX_RRF}. */
    public static final double TARGET_MAX_SIMILARITY = 0.6;

    private FusionConstants() {
    }
}
