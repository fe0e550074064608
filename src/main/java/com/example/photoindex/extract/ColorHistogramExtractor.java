package com.example.photoindex.extract;

/**
 * Model-free extractor: a 64-bin colour histogram (4 levels per RGB channel), L1-normalised.
 * Coarse, but cheap and available without any model file.
 */
public class ColorHistogramExtractor implements FeatureExtractor {

    public static final int BINS = 64;

    @Override
    public ExtractionResult extract(DecodedImage image, int maxDimension) {
        if (image == null) {
            return ExtractionResult.failure(FailureKind.EXTRACTION, "No image to extract from");
        }
        DecodedImage scaled = OpenCvImages.fitWithin(image, maxDimension);

        float[] hist = new float[BINS];
        int w = scaled.getWidth();
        int h = scaled.getHeight();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int[] bgr = scaled.bgr(x, y);
                int ri = bgr[2] >> 6; // 0..3
                int gi = bgr[1] >> 6;
                int bi = bgr[0] >> 6;
                hist[(ri << 4) | (gi << 2) | bi] += 1f;
            }
        }

        float sum = (float) (w * h);
        for (int i = 0; i < hist.length; i++) {
            hist[i] /= sum;
        }
        return ExtractionResult.success(hist);
    }

    @Override
    public String version() {
        return "color-hist-64/1";
    }
}
