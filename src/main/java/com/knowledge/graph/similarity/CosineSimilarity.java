package com.knowledge.graph.similarity;

/**
 * Cosine similarity between embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return cosine similarity, or 0.0 when either vector is missing, empty,
     *         zero-length or of a different dimension
     */
    public static double compute(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
