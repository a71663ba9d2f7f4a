package com.knowledge.graph.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * {@link EmbeddingProvider} backed by an Ollama embedding model.
 * Failures propagate so that callers can degrade the affected signal.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    public static final String DEFAULT_MODEL = "nomic-embed-text";

    private final OllamaClient client;
    private final String model;

    public OllamaEmbeddingProvider(OllamaClient client, String model) {
        this.client = client;
        this.model = model != null ? model : DEFAULT_MODEL;
    }

    @Override
    public float[] embed(String text) {
        try {
            float[] vector = client.embed(model, text);
            log.trace("embedding.created model={} dimensions={}", model, vector.length);
            return vector;
        } catch (IOException e) {
            throw new UncheckedIOException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while embedding", e);
        }
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        return client.isAvailable();
    }
}
