package com.knowledge.graph.llm;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Caffeine cache in front of an {@link EmbeddingProvider}, keyed by exact text.
 * Empty embeddings are not cached so a recovering provider is retried.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingProvider.class);

    private final EmbeddingProvider delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, CacheConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingEmbeddingProvider initialized: provider={}, maxSize={}, ttl={}s",
                delegate.getProviderName(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public float[] embed(String text) {
        float[] cached = cache.getIfPresent(text);
        if (cached != null) {
            return cached.clone();
        }
        float[] embedding = delegate.embed(text);
        if (embedding != null && embedding.length > 0) {
            cache.put(text, embedding.clone());
        }
        return embedding;
    }

    @Override
    public String getProviderName() {
        return "Cached/" + delegate.getProviderName();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
