package com.example.photoindex.model;

/**
 * One hit of a similarity query.
 */
public final class SimilarPhoto {
    private final String photoId;
    private final double similarity;

    public SimilarPhoto(String photoId, double similarity) {
        if (photoId == null || photoId.isEmpty()) {
            throw new IllegalArgumentException("photoId cannot be null or empty");
        }
        this.photoId = photoId;
        this.similarity = similarity;
    }

    public String getPhotoId() {
        return photoId;
    }

    public double getSimilarity() {
        return similarity;
    }

    public int getPercentage() {
        return (int) (similarity * 100);
    }

    @Override
    public String toString() {
        return "SimilarPhoto{photoId='" + photoId + "', similarity=" + String.format("%.4f", similarity) + "}";
    }
}
