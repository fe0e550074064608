package com.example.photoindex.extract;

/**
 * Why an embedding could not be produced.
 */
public enum FailureKind {
    /** Source image unreadable. Transient, counted against the retry cap. */
    DECODE,
    /** Feature computation failed. Transient, counted against the retry cap. */
    EXTRACTION,
    /** Durable write failed. Reported only, never counted or retried automatically. */
    PERSIST
}
