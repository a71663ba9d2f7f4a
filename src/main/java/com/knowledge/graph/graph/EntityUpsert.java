package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Entity;

/**
 * Outcome of an idempotent entity upsert.
 *
 * @param entity  the node as stored after the upsert
 * @param created true when this call created the node
 */
public record EntityUpsert(Entity entity, boolean created) {
}
