package com.example.photoindex.store;

import com.example.photoindex.PhotoIndexException;

/**
 * A durable write to the embedding store failed. Reported to the caller and never retried by the index.
 */
public class PersistFailureException extends PhotoIndexException {

    public PersistFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
