package com.example.photoindex.model;

/**
 * Coverage of the embedding store relative to the library.
 */
public final class EmbeddingStats {
    private final int totalPhotos;
    private final int photosWithEmbeddings;
    private final int permanentFailures;

    public EmbeddingStats(int totalPhotos, int photosWithEmbeddings, int permanentFailures) {
        this.totalPhotos = totalPhotos;
        this.photosWithEmbeddings = photosWithEmbeddings;
        this.permanentFailures = permanentFailures;
    }

    public int getTotalPhotos() {
        return totalPhotos;
    }

    public int getPhotosWithEmbeddings() {
        return photosWithEmbeddings;
    }

    public int getPermanentFailures() {
        return permanentFailures;
    }

    public float getCoverage() {
        return totalPhotos > 0 ? (float) photosWithEmbeddings / totalPhotos : 0f;
    }

    public int getCoveragePercentage() {
        return (int) (getCoverage() * 100);
    }

    @Override
    public String toString() {
        return "EmbeddingStats{" + photosWithEmbeddings + "/" + totalPhotos
                + " (" + getCoveragePercentage() + "%), permanentFailures=" + permanentFailures + "}";
    }
}
