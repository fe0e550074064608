package com.example.photoindex.metadata;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Small key/value state the index persists next to the library: stack assignments and the scan watermark.
 */
public interface MetadataStore {

    /** The stack a photo belongs to; empty for singletons and unknown photos. */
    OptionalLong getStackId(String photoId);

    void setStackId(String photoId, long stackId);

    /**
     * Resets every stack assignment to "no stack".
     *
     * @return the number of assignments cleared
     */
    int clearAllStackIds();

    /**
     * Highest stack id ever persisted. Not lowered by {@link #clearAllStackIds()}, so new ids never collide
     * with ids handed out earlier.
     */
    long maxStackId();

    Optional<Instant> getWatermark();

    void setWatermark(Instant watermark);

    void clearWatermark();
}
