package com.example.photoindex.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Consecutive captures shown as one unit. Singletons carry no stack id.
 */
public final class PhotoStack {
    private final String id;
    private final List<PhotoRef> photos;
    private final long stackId;

    private PhotoStack(List<PhotoRef> photos, long stackId) {
        if (photos == null || photos.isEmpty()) {
            throw new IllegalArgumentException("PhotoStack cannot be created from an empty photo list");
        }
        this.photos = Collections.unmodifiableList(new ArrayList<>(photos));
        this.id = photos.stream().map(PhotoRef::getId).collect(Collectors.joining("-"));
        this.stackId = stackId;
    }

    public static PhotoStack single(PhotoRef photo) {
        return new PhotoStack(Collections.singletonList(photo), 0L);
    }

    public static PhotoStack of(List<PhotoRef> photos, long stackId) {
        if (photos != null && photos.size() > 1 && stackId <= 0) {
            throw new IllegalArgumentException("multi-photo stacks need a positive stack id");
        }
        return new PhotoStack(photos, photos != null && photos.size() > 1 ? stackId : 0L);
    }

    public String getId() {
        return id;
    }

    public List<PhotoRef> getPhotos() {
        return photos;
    }

    public PhotoRef getPrimary() {
        return photos.get(0);
    }

    public Instant getCreationTime() {
        return getPrimary().getCreationTime();
    }

    public OptionalLong getStackId() {
        return stackId > 0 ? OptionalLong.of(stackId) : OptionalLong.empty();
    }

    public boolean isStack() {
        return photos.size() > 1;
    }

    public int getCount() {
        return photos.size();
    }

    @Override
    public String toString() {
        return "PhotoStack{id='" + id + "', count=" + photos.size()
                + (stackId > 0 ? ", stackId=" + stackId : "") + "}";
    }
}
