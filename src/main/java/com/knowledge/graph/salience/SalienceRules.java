package com.knowledge.graph.salience;

import com.knowledge.graph.core.model.Entity;
import com.knowledge.graph.core.model.EntityState;

import java.time.Instant;

/**
 * Pure next-state function for salience bookkeeping. The Cypher bulk statement in
 * {@code CypherExecutor#incrementAccess} encodes the same rules.
 */
public final class SalienceRules {

    /** Cumulative accesses that promote an entity to {@link EntityState#CORE}. */
    public static final long CORE_THRESHOLD = 10;

    /** Cumulative accesses that promote an entity to {@link EntityState#ACTIVE}. */
    public static final long ACTIVE_THRESHOLD = 1;

    private SalienceRules() {
    }

    public static Entity apply(Entity current, SalienceUpdate update, Instant now) {
        double salience = clamp(current.getSalience() + update.delta());
        Entity.Builder next = current.toBuilder()
                .salience(salience)
                .updatedAt(now);
        if (update.countAccess()) {
            long accessCount = current.getAccessCount() + 1;
            next.accessCount(accessCount)
                    .recallFrequency(current.getRecallFrequency() + 1)
                    .lastAccessedAt(now)
                    .state(nextState(current.getState(), accessCount));
        }
        return next.build();
    }

    /**
     * State after counters reached {@code accessCount}. Never moves backwards.
     */
    public static EntityState nextState(EntityState current, long accessCount) {
        EntityState target;
        if (accessCount >= CORE_THRESHOLD) {
            target = EntityState.CORE;
        } else if (accessCount >= ACTIVE_THRESHOLD) {
            target = EntityState.ACTIVE;
        } else {
            target = EntityState.CANDIDATE;
        }
        return current != null && current.isAtLeast(target) ? current : target;
    }

    public static double clamp(double salience) {
        return Math.max(0.0, Math.min(1.0, salience));
    }
}
