package com.knowledge.graph.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CachingEmbeddingProvider Tests")
class CachingEmbeddingProviderTest {

    private EmbeddingProvider delegate;
    private CachingEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        delegate = mock(EmbeddingProvider.class);
        when(delegate.getProviderName()).thenReturn("Mock");
        provider = new CachingEmbeddingProvider(delegate, CacheConfig.defaults());
    }

    @Test
    @DisplayName("Repeated text is embedded once")
    void cachesByText() {
        when(delegate.embed("graphs")).thenReturn(new float[]{1f, 2f});

        float[] first = provider.embed("graphs");
        float[] second = provider.embed("graphs");

        assertArrayEquals(first, second);
        verify(delegate, times(1)).embed("graphs");
        assertEquals(1, provider.stats().hitCount());
    }

    @Test
    @DisplayName("Callers cannot corrupt cached vectors")
    void defensiveCopies() {
        when(delegate.embed("graphs")).thenReturn(new float[]{1f, 2f});

        provider.embed("graphs")[0] = 99f;

        assertArrayEquals(new float[]{1f, 2f}, provider.embed("graphs"));
    }

    @Test
    @DisplayName("Empty embeddings are retried")
    void emptyNotCached() {
        when(delegate.embed("graphs")).thenReturn(new float[0]);

        provider.embed("graphs");
        provider.embed("graphs");

        verify(delegate, times(2)).embed("graphs");
    }

    @Test
    @DisplayName("Cache config rejects non-positive limits")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
    }

    @Test
    @DisplayName("Provider name shows the cache layer")
    void providerName() {
        assertEquals("Cached/Mock", provider.getProviderName());
    }
}
