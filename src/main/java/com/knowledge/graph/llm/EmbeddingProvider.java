package com.knowledge.graph.llm;

/**
 * Turns text into an embedding vector.
 */
public interface EmbeddingProvider {

    /**
     * @return the embedding, or an empty array when none can be produced
     */
    float[] embed(String text);

    String getProviderName();

    boolean isAvailable();
}
