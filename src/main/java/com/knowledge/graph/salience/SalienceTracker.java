package com.knowledge.graph.salience;

import com.knowledge.graph.graph.KnowledgeGraphStore;
import com.knowledge.graph.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Access and salience bookkeeping for graph nodes.
 *
 * <p>Each access raises salience by {@value SalienceUpdate#ACCESS_BOOST} (capped at
 * 1.0), bumps {@code access_count} and {@code recall_frequency}, stamps
 * {@code last_accessed_at} and promotes state: active from the first access, core
 * from the tenth. The update is applied by the store as one atomic operation per
 * node; a batch is one bulk statement.</p>
 *
 * <p>Decay is not scheduled here. An external job calls {@link #applyDelta} with a
 * negative delta.</p>
 */
public class SalienceTracker {
    private static final Logger log = LoggerFactory.getLogger(SalienceTracker.class);

    private final KnowledgeGraphStore store;
    private final MetricsService metrics;

    public SalienceTracker(KnowledgeGraphStore store, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public void incrementAccess(String entityKey) {
        Objects.requireNonNull(entityKey, "entityKey is required");
        store.applySalienceUpdate(List.of(entityKey), SalienceUpdate.access());
        log.trace("salience.access entityKey={}", entityKey);
    }

    /**
     * Counts one access for each distinct key, in a single store round trip.
     */
    public void batchIncrementAccess(Collection<String> entityKeys) {
        Set<String> distinct = new LinkedHashSet<>(entityKeys);
        if (distinct.isEmpty()) {
            return;
        }
        store.applySalienceUpdate(distinct, SalienceUpdate.access());
        metrics.recordAccessBatchSize(distinct.size());
        log.debug("salience.batchAccess nodes={}", distinct.size());
    }

    /**
     * Adds {@code delta} to salience, clamped to [0, 1], without counting an access.
     */
    public void applyDelta(String entityKey, double delta) {
        store.applySalienceUpdate(List.of(entityKey), SalienceUpdate.adjust(delta));
        log.trace("salience.adjust entityKey={} delta={}", entityKey, delta);
    }

    public void applyDelta(Collection<String> entityKeys, double delta) {
        if (entityKeys.isEmpty()) {
            return;
        }
        store.applySalienceUpdate(new LinkedHashSet<>(entityKeys), SalienceUpdate.adjust(delta));
    }

    public Optional<Double> currentSalience(String entityKey) {
        return store.calculateSalience(entityKey);
    }

    /**
     * Current salience per existing key; unknown keys are absent.
     */
    public Map<String, Double> currentSalience(Collection<String> entityKeys) {
        if (entityKeys.isEmpty()) {
            return Map.of();
        }
        return store.calculateSalience(entityKeys);
    }
}
