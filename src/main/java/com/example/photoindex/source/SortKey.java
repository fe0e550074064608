package com.example.photoindex.source;

import com.example.photoindex.model.PhotoRef;

import java.util.Comparator;

/**
 * Enumeration order for an asset source. Ties on time fall back to the id so the order is total.
 */
public enum SortKey {
    CREATION_TIME_ASCENDING(Comparator.comparing(PhotoRef::getCreationTime).thenComparing(PhotoRef::getId)),
    CREATION_TIME_DESCENDING(Comparator.comparing(PhotoRef::getCreationTime).reversed()
            .thenComparing(PhotoRef::getId));

    private final Comparator<PhotoRef> comparator;

    SortKey(Comparator<PhotoRef> comparator) {
        this.comparator = comparator;
    }

    public Comparator<PhotoRef> comparator() {
        return comparator;
    }
}
