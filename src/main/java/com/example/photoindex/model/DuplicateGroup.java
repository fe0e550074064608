package com.example.photoindex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A seed photo and the photos found to be near-duplicates of it.
 */
public final class DuplicateGroup {
    private final String originalId;
    private final List<SimilarPhoto> duplicates;

    public DuplicateGroup(String originalId, List<SimilarPhoto> duplicates) {
        if (originalId == null || originalId.isEmpty()) {
            throw new IllegalArgumentException("originalId cannot be null or empty");
        }
        if (duplicates == null || duplicates.isEmpty()) {
            throw new IllegalArgumentException("a duplicate group needs at least one match");
        }
        this.originalId = originalId;
        this.duplicates = Collections.unmodifiableList(new ArrayList<>(duplicates));
    }

    public String getOriginalId() {
        return originalId;
    }

    public List<SimilarPhoto> getDuplicates() {
        return duplicates;
    }

    /** Seed first, then matches in discovery order. */
    public List<String> getAllIds() {
        List<String> ids = new ArrayList<>(duplicates.size() + 1);
        ids.add(originalId);
        for (SimilarPhoto duplicate : duplicates) {
            ids.add(duplicate.getPhotoId());
        }
        return ids;
    }

    public int getCount() {
        return duplicates.size() + 1;
    }

    @Override
    public String toString() {
        return "DuplicateGroup{original='" + originalId + "', count=" + getCount() + "}";
    }
}
