package com.example.photoindex;

/**
 * Base class for unchecked failures raised by the photo index.
 */
public class PhotoIndexException extends RuntimeException {

    public PhotoIndexException(String message) {
        super(message);
    }

    public PhotoIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
