package com.knowledge.graph.salience;

/**
 * One application of the salience update primitive.
 *
 * @param delta       amount added to salience before clamping to [0, 1]
 * @param countAccess whether the update counts as an access (counters, timestamp and state)
 */
public record SalienceUpdate(double delta, boolean countAccess) {

    /** Fixed salience boost per access; midpoint of the [0.05, 0.1] design range. */
    public static final double ACCESS_BOOST = 0.075;

    public SalienceUpdate {
        if (Double.isNaN(delta) || delta < -1.0 || delta > 1.0) {
            throw new IllegalArgumentException("delta must be between -1.0 and 1.0, was " + delta);
        }
    }

    public static SalienceUpdate access() {
        return new SalienceUpdate(ACCESS_BOOST, true);
    }

    /**
     * A plain adjustment, as issued by an external decay job with a negative delta.
     */
    public static SalienceUpdate adjust(double delta) {
        return new SalienceUpdate(delta, false);
    }
}
