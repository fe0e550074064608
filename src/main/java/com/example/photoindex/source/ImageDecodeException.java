package com.example.photoindex.source;

/**
 * The source image for a photo could not be read or decoded.
 */
public class ImageDecodeException extends Exception {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
