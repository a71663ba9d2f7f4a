package com.knowledge.graph.llm;

/**
 * Produces no embeddings. Vector-based signals and tiers are skipped when this is in use.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {

    private static final float[] EMPTY = new float[0];

    @Override
    public float[] embed(String text) {
        return EMPTY;
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
