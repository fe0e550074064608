package com.example.photoindex.extract;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

/**
 * Resampling of decoded pixels through OpenCV, and conversion between {@link Mat} and {@link DecodedImage}.
 *
 * <p>Images that need no resampling are returned as they are, without touching the native library.</p>
 */
public final class OpenCvImages {

    private OpenCvImages() {}

    /**
     * Area-interpolated downsample so that neither side exceeds {@code maxDimension}.
     * Returns the same image when it already fits.
     */
    public static DecodedImage fitWithin(DecodedImage image, int maxDimension) {
        checkMaxDimension(maxDimension);
        if (Math.max(image.getWidth(), image.getHeight()) <= maxDimension) {
            return image;
        }
        Mat mat = toMat(image);
        try {
            return fitWithin(mat, maxDimension);
        } finally {
            mat.release();
        }
    }

    /**
     * Same as {@link #fitWithin(DecodedImage, int)} for a freshly decoded 8-bit {@code Mat}. The caller
     * keeps ownership of {@code mat}.
     */
    public static DecodedImage fitWithin(Mat mat, int maxDimension) {
        checkMaxDimension(maxDimension);
        int maxSide = Math.max(mat.cols(), mat.rows());
        if (maxSide <= maxDimension) {
            return toDecodedImage(mat);
        }
        double scale = (double) maxDimension / maxSide;
        int width = Math.max(1, (int) Math.round(mat.cols() * scale));
        int height = Math.max(1, (int) Math.round(mat.rows() * scale));
        return resize(mat, width, height, opencv_imgproc.INTER_AREA);
    }

    /**
     * Bilinear resize to an exact size, used to fit model input shapes.
     */
    public static DecodedImage resize(DecodedImage image, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid target size: " + width + "x" + height);
        }
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        Mat mat = toMat(image);
        try {
            return resize(mat, width, height, opencv_imgproc.INTER_LINEAR);
        } finally {
            mat.release();
        }
    }

    /** Copies the pixels into a new {@code Mat}; release it when done. */
    static Mat toMat(DecodedImage image) {
        int type = image.getChannels() == 3 ? opencv_core.CV_8UC3 : opencv_core.CV_8UC1;
        Mat mat = new Mat(image.getHeight(), image.getWidth(), type);
        BytePointer data = mat.data();
        data.put(image.pixels());
        return mat;
    }

    static DecodedImage toDecodedImage(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            int width = continuous.cols();
            int height = continuous.rows();
            int channels = continuous.channels();
            byte[] pixels = new byte[width * height * channels];
            BytePointer data = continuous.data();
            data.get(pixels);
            return new DecodedImage(width, height, channels, pixels);
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    private static DecodedImage resize(Mat mat, int width, int height, int interpolation) {
        Size size = new Size(width, height);
        Mat resized = new Mat();
        try {
            opencv_imgproc.resize(mat, resized, size, 0, 0, interpolation);
            return toDecodedImage(resized);
        } finally {
            resized.release();
            size.close();
        }
    }

    private static void checkMaxDimension(int maxDimension) {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive");
        }
    }
}
