package com.example.photoindex.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A photo as seen by the asset source: a stable id plus its creation and modification times.
 */
public final class PhotoRef {
    private final String id;
    private final Instant creationTime;
    private final Instant modificationTime;

    public PhotoRef(String id, Instant creationTime, Instant modificationTime) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (creationTime == null) {
            throw new IllegalArgumentException("creationTime cannot be null");
        }
        this.id = id;
        this.creationTime = creationTime;
        // Assets that were never edited report their creation time.
        this.modificationTime = modificationTime != null ? modificationTime : creationTime;
    }

    public String getId() {
        return id;
    }

    public Instant getCreationTime() {
        return creationTime;
    }

    public Instant getModificationTime() {
        return modificationTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PhotoRef)) {
            return false;
        }
        PhotoRef other = (PhotoRef) o;
        return id.equals(other.id)
                && creationTime.equals(other.creationTime)
                && modificationTime.equals(other.modificationTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, creationTime, modificationTime);
    }

    @Override
    public String toString() {
        return "PhotoRef{id='" + id + "', created=" + creationTime + ", modified=" + modificationTime + "}";
    }
}
