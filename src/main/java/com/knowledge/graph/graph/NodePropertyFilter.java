package com.knowledge.graph.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Strips bookkeeping properties from nodes before they leave the store.
 */
public final class NodePropertyFilter {

    public static final Set<String> INTERNAL_PROPERTIES = Set.of(
            "embedding",
            "is_dirty",
            "decay_gradient",
            "recall_frequency",
            "canonical_name_lower",
            "normalized_name",
            "creation_id",
            "user_id"
    );

    private NodePropertyFilter() {
    }

    /**
     * Copy of the properties without internal keys or null values.
     */
    public static Map<String, Object> filter(Map<String, Object> properties) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null && !INTERNAL_PROPERTIES.contains(key)) {
                filtered.put(key, value);
            }
        });
        return filtered;
    }
}
