package com.example.photoindex.source;

import com.example.photoindex.extract.DecodedImage;
import com.example.photoindex.model.PhotoRef;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The media library the index reads from. The index never writes to it.
 */
public interface AssetSource {

    /**
     * All photos accepted by {@code filter} (all photos when it is null), in {@code sortKey} order.
     */
    List<PhotoRef> enumerate(SortKey sortKey, Predicate<PhotoRef> filter);

    /**
     * Decodes the photo, downsampled so that neither side exceeds {@code maxDimension}.
     */
    DecodedImage loadImage(String id, int maxDimension) throws ImageDecodeException;

    Optional<PhotoRef> find(String id);

    default boolean exists(String id) {
        return find(id).isPresent();
    }

    default int count() {
        return enumerate(SortKey.CREATION_TIME_ASCENDING, null).size();
    }
}
