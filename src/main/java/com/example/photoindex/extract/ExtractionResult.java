package com.example.photoindex.extract;

/**
 * Outcome of a feature extraction: either a vector or a recoverable failure.
 */
public final class ExtractionResult {
    private final float[] vector;
    private final FailureKind failureKind;
    private final String message;

    private ExtractionResult(float[] vector, FailureKind failureKind, String message) {
        this.vector = vector;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static ExtractionResult success(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector cannot be null or empty");
        }
        return new ExtractionResult(vector.clone(), null, null);
    }

    public static ExtractionResult failure(FailureKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("failure kind cannot be null");
        }
        return new ExtractionResult(null, kind, message);
    }

    public boolean isSuccess() {
        return vector != null;
    }

    public float[] getVector() {
        if (vector == null) {
            throw new IllegalStateException("No vector on a failed extraction: " + message);
        }
        return vector.clone();
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ExtractionResult{vectorDim=" + vector.length + "}"
                : "ExtractionResult{failure=" + failureKind + ", message='" + message + "'}";
    }
}
