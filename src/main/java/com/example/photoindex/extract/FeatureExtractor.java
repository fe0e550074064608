package com.example.photoindex.extract;

/**
 * Turns a decoded image into a fixed-length feature vector.
 *
 * <p>Implementations are deterministic for identical input under one {@link #version()} and never throw for
 * bad input: every failure comes back as {@link ExtractionResult#failure}.</p>
 */
public interface FeatureExtractor extends AutoCloseable {

    ExtractionResult extract(DecodedImage image, int maxDimension);

    String version();

    @Override
    default void close() throws Exception {
    }
}
