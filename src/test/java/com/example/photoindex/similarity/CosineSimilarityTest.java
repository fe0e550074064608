package com.example.photoindex.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CosineSimilarityTest {

    @Test
    @DisplayName("a vector is fully similar to itself")
    void selfSimilarityIsOne() {
        float[] v = {0.3f, -1.2f, 4.5f, 0.01f};
        assertThat(CosineSimilarity.of(v, v)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        float[] v = {1f, 2f, 3f};
        float[] zero = new float[3];
        assertThat(CosineSimilarity.of(v, zero)).isZero();
        assertThat(CosineSimilarity.of(zero, zero)).isZero();
    }

    @Test
    void oppositeAndOrthogonalVectors() {
        assertThat(CosineSimilarity.of(new float[]{1f, 0f}, new float[]{-2f, 0f})).isCloseTo(-1.0, within(1e-9));
        assertThat(CosineSimilarity.of(new float[]{1f, 0f}, new float[]{0f, 5f})).isZero();
    }

    @Test
    void scaleDoesNotMatter() {
        float[] a = {1f, 2f, 2f};
        float[] b = {10f, 20f, 20f};
        assertThat(CosineSimilarity.of(a, b)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("vectors of different dimension never match")
    void dimensionMismatchIsZero() {
        assertThat(CosineSimilarity.of(new float[]{1f, 0f}, new float[]{1f, 0f, 0f})).isZero();
    }

    @Test
    void resultIsClampedToValidRange() {
        float[] v = {1e-3f, 1e-3f, 1e-3f, 1e-3f, 1e-3f};
        double similarity = CosineSimilarity.of(v, v.clone());
        assertThat(similarity).isBetween(-1.0, 1.0);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> CosineSimilarity.of(null, new float[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeProducesUnitLength() {
        float[] normalized = CosineSimilarity.normalize(new float[]{3f, 4f});
        assertThat(normalized[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(normalized[1]).isCloseTo(0.8f, within(1e-6f));
    }

    @Test
    void normalizeLeavesZeroVectorAlone() {
        assertThat(CosineSimilarity.normalize(new float[3])).containsExactly(0f, 0f, 0f);
    }
}
