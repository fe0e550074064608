package com.example.photoindex.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OnnxFeatureExtractorTest {

    @Test
    void convertsBgrPixelsToNormalisedRgbPlanes() {
        // Two pixels: pure red, then pure blue.
        byte[] bgr = {0, 0, (byte) 255, (byte) 255, 0, 0};
        float[] chw = OnnxFeatureExtractor.toNormalizedChw(new DecodedImage(2, 1, 3, bgr));

        assertThat(chw).hasSize(6);
        // R plane
        assertThat(chw[0]).isCloseTo((1f - 0.485f) / 0.229f, within(1e-5f));
        assertThat(chw[1]).isCloseTo(-0.485f / 0.229f, within(1e-5f));
        // B plane
        assertThat(chw[4]).isCloseTo(-0.406f / 0.225f, within(1e-5f));
        assertThat(chw[5]).isCloseTo((1f - 0.406f) / 0.225f, within(1e-5f));
    }
}
