package com.example.photoindex.compute;

import com.example.photoindex.extract.FailureKind;
import com.example.photoindex.model.Embedding;

import java.time.Duration;

/**
 * Outcome of a compute-or-fetch for one photo. Interactive callers inspect it to decide whether to offer a retry.
 */
public final class ComputeResult {

    public enum Status {
        /** A fresh embedding was already stored. */
        CACHED,
        /** The embedding was extracted and stored now. */
        COMPUTED,
        /** This attempt failed; see {@link #getFailureKind()}. */
        FAILED,
        /** Skipped because earlier attempts exhausted the retry cap. */
        PERMANENTLY_FAILED
    }

    private final String photoId;
    private final Status status;
    private final Embedding embedding;
    private final FailureKind failureKind;
    private final String message;
    private final int attempts;
    private final Duration elapsed;

    private ComputeResult(String photoId, Status status, Embedding embedding, FailureKind failureKind,
                          String message, int attempts, Duration elapsed) {
        this.photoId = photoId;
        this.status = status;
        this.embedding = embedding;
        this.failureKind = failureKind;
        this.message = message;
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    static ComputeResult cached(Embedding embedding) {
        return new ComputeResult(embedding.getPhotoId(), Status.CACHED, embedding, null, null, 0, Duration.ZERO);
    }

    static ComputeResult computed(Embedding embedding, Duration elapsed) {
        return new ComputeResult(embedding.getPhotoId(), Status.COMPUTED, embedding, null, null, 0, elapsed);
    }

    static ComputeResult failed(String photoId, FailureKind kind, String message, int attempts, Duration elapsed) {
        return new ComputeResult(photoId, Status.FAILED, null, kind, message, attempts, elapsed);
    }

    static ComputeResult permanentlyFailed(String photoId, int attempts) {
        return new ComputeResult(photoId, Status.PERMANENTLY_FAILED, null, null,
                "failed " + attempts + " times, marked as permanently failed", attempts, Duration.ZERO);
    }

    public String getPhotoId() {
        return photoId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return embedding != null;
    }

    /** The stored embedding; null unless {@link #isSuccess()}. */
    public Embedding getEmbedding() {
        return embedding;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    /** Failed attempts recorded for this photo so far. Persist failures do not add to it. */
    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "ComputeResult{photoId='" + photoId + "', status=" + status
                + (failureKind != null ? ", failure=" + failureKind + ", message='" + message + "'" : "")
                + "}";
    }
}
