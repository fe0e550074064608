package com.example.photoindex.stack;

import com.example.photoindex.metadata.MetadataStore;

/**
 * Hands out stack ids that are strictly greater than every id persisted or issued before, for the
 * lifetime of the process, even after all assignments have been cleared.
 */
public class StackIdAllocator {

    private final MetadataStore metadata;
    private long lastIssued;

    public StackIdAllocator(MetadataStore metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        this.metadata = metadata;
    }

    public synchronized long next() {
        lastIssued = Math.max(lastIssued, metadata.maxStackId()) + 1;
        return lastIssued;
    }
}
