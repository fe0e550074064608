package com.example.photoindex.extract;

/**
 * Decoded 8-bit pixels in interleaved row-major layout. Three-channel images are BGR, as OpenCV loads them.
 */
public final class DecodedImage {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] pixels;

    public DecodedImage(int width, int height, int channels, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid image size: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (pixels == null || pixels.length != width * height * channels) {
            throw new IllegalArgumentException("Invalid pixel buffer for " + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /** Raw buffer, not copied. Callers must not modify it. */
    public byte[] pixels() {
        return pixels;
    }

    /** Unsigned sample value 0..255. */
    public int sample(int x, int y, int channel) {
        return pixels[(y * width + x) * channels + channel] & 0xFF;
    }

    /**
     * Blue, green and red of a pixel in that order. Grayscale images report the same value three times.
     */
    public int[] bgr(int x, int y) {
        if (channels == 1) {
            int v = sample(x, y, 0);
            return new int[]{v, v, v};
        }
        return new int[]{sample(x, y, 0), sample(x, y, 1), sample(x, y, 2)};
    }

    @Override
    public String toString() {
        return "DecodedImage{" + width + "x" + height + "x" + channels + "}";
    }
}
