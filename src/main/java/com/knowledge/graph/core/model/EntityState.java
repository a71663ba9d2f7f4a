package com.knowledge.graph.core.model;

/**
 * Promotion level of an entity, driven by cumulative access count.
 * Transitions only move forward: candidate to active to core.
 */
public enum EntityState {
    CANDIDATE("candidate"),
    ACTIVE("active"),
    CORE("core");

    private final String value;

    EntityState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses a stored state value. Unknown or missing values read as {@link #CANDIDATE}.
     */
    public static EntityState fromValue(String value) {
        if (value == null) {
            return CANDIDATE;
        }
        for (EntityState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        return CANDIDATE;
    }

    public boolean isAtLeast(EntityState other) {
        return ordinal() >= other.ordinal();
    }
}
