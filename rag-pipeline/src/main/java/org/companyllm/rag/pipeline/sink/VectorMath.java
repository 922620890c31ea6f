package org.companyllm.rag.pipeline.sink;

/**
 * Similarity helpers for the brute-force stores.
 */
public class VectorMath {
    private VectorMath() {
        // Utility class, no instances
    }

    /**
     * Cosine similarity in [-1, 1]; zero when either vector has zero length.
     *
     * @throws IllegalArgumentException when the dimensions differ
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
