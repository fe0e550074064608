package com.example.photoindex.similarity;

/**
 * Cosine similarity over raw float vectors.
 */
public final class CosineSimilarity {
    private CosineSimilarity() {}

    /**
     * Returns dot(a, b) / (|a| * |b|).
     * Zero when either vector has zero norm, and zero for vectors of different dimension,
     * which only happens when two embeddings come from different extractor versions.
     */
    public static double of(float[] v1, float[] v2) {
        if (v1 == null || v2 == null) {
            throw new IllegalArgumentException("vectors cannot be null");
        }
        if (v1.length != v2.length) {
            return 0.0;
        }

        double dot = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < v1.length; i++) {
            dot += (double) v1[i] * v2[i];
            norm1 += (double) v1[i] * v1[i];
            norm2 += (double) v2[i] * v2[i];
        }

        double denominator = Math.sqrt(norm1) * Math.sqrt(norm2);
        if (denominator == 0.0) {
            return 0.0;
        }

        // Rounding can push identical directions a hair past 1.
        double similarity = dot / denominator;
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * L2-normalises a copy of the vector. Vectors with (near) zero norm are returned unchanged.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        if (norm < 1e-10) {
            return vector.clone();
        }

        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }
}
