package com.knowledge.graph.llm;

/**
 * Configuration for the embedding cache.
 *
 * @param maxSize    maximum number of cached texts
 * @param ttlSeconds time-to-live per entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 entries, one hour, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
