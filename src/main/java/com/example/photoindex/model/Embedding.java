package com.example.photoindex.model;

import com.example.photoindex.similarity.CosineSimilarity;

import java.time.Instant;

/**
 * Cached feature vector for one photo, with the bookkeeping needed to decide when it goes stale.
 */
public final class Embedding {
    private final String photoId;
    private final float[] vector;
    private final String contentHash;
    private final Instant computedAt;
    private final Instant sourceModifiedAt;

    public Embedding(String photoId, float[] vector, String contentHash,
                     Instant computedAt, Instant sourceModifiedAt) {
        if (photoId == null || photoId.isEmpty()) {
            throw new IllegalArgumentException("photoId cannot be null or empty");
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector cannot be null or empty");
        }
        if (computedAt == null || sourceModifiedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }

        this.photoId = photoId;
        this.vector = vector.clone();
        this.contentHash = contentHash;
        this.computedAt = computedAt;
        this.sourceModifiedAt = sourceModifiedAt;
    }

    public String getPhotoId() {
        return photoId;
    }

    public float[] getVector() {
        return vector.clone();
    }

    public int getDimension() {
        return vector.length;
    }

    public String getContentHash() {
        return contentHash;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public Instant getSourceModifiedAt() {
        return sourceModifiedAt;
    }

    /**
     * An embedding stays valid as long as the photo has not been modified after it was computed.
     */
    public boolean isFreshFor(PhotoRef photo) {
        return !photo.getModificationTime().isAfter(computedAt);
    }

    public double cosineSimilarity(Embedding other) {
        if (other == null) {
            throw new IllegalArgumentException("other embedding cannot be null");
        }
        return CosineSimilarity.of(this.vector, other.vector);
    }

    @Override
    public String toString() {
        return "Embedding{photoId='" + photoId + "', vectorDim=" + vector.length
                + ", computedAt=" + computedAt + "}";
    }
}
