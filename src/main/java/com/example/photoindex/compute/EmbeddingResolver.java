package com.example.photoindex.compute;

import com.example.photoindex.IndexContext;
import com.example.photoindex.extract.ContentHash;
import com.example.photoindex.extract.DecodedImage;
import com.example.photoindex.extract.ExtractionResult;
import com.example.photoindex.extract.FailureKind;
import com.example.photoindex.failure.FailureTracker;
import com.example.photoindex.model.Embedding;
import com.example.photoindex.model.PhotoRef;
import com.example.photoindex.source.ImageDecodeException;
import com.example.photoindex.store.PersistFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Compute-or-fetch: returns the stored embedding while it is fresh, otherwise decodes the photo,
 * extracts a new vector and stores it.
 *
 * <p>Decode and extraction failures are counted by the {@link FailureTracker}; persist failures are only
 * reported. No lock is held while an image is decoded or a vector extracted.</p>
 */
public class EmbeddingResolver {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingResolver.class);

    private final IndexContext context;

    public EmbeddingResolver(IndexContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /** The stored embedding, if there is one and the photo was not modified after it was computed. */
    public Optional<Embedding> findFresh(PhotoRef photo) {
        return context.getStore().get(photo.getId()).filter(e -> e.isFreshFor(photo));
    }

    public ComputeResult resolve(PhotoRef photo) {
        if (photo == null) {
            throw new IllegalArgumentException("photo cannot be null");
        }
        Optional<Embedding> fresh = findFresh(photo);
        if (fresh.isPresent()) {
            log.trace("Embedding up to date for {}", photo.getId());
            return ComputeResult.cached(fresh.get());
        }

        FailureTracker tracker = context.getFailureTracker();
        String id = photo.getId();
        if (tracker.isPermanentlyFailed(id)) {
            log.debug("Skipping {} - permanently failed", id);
            return ComputeResult.permanentlyFailed(id, tracker.getMaxRetries());
        }

        long start = System.nanoTime();
        int maxDimension = context.getConfig().getMaxImageDimension();

        DecodedImage image;
        try {
            image = context.getAssetSource().loadImage(id, maxDimension);
        } catch (ImageDecodeException e) {
            return recordFailure(id, FailureKind.DECODE, e.getMessage(), start);
        }

        ExtractionResult extraction;
        try {
            extraction = context.getExtractor().extract(image, maxDimension);
        } catch (RuntimeException e) {
            extraction = ExtractionResult.failure(FailureKind.EXTRACTION, e.toString());
        }
        if (!extraction.isSuccess()) {
            return recordFailure(id, extraction.getFailureKind(), extraction.getMessage(), start);
        }

        // Never stamp a computation earlier than the modification it reflects.
        Instant now = context.getClock().instant();
        Instant computedAt = now.isBefore(photo.getModificationTime()) ? photo.getModificationTime() : now;

        Embedding stored;
        try {
            stored = context.getStore().put(id, extraction.getVector(), ContentHash.of(image),
                    computedAt, photo.getModificationTime());
        } catch (PersistFailureException e) {
            log.error("Failed to save embedding for {}", id, e);
            return ComputeResult.failed(id, FailureKind.PERSIST, e.getMessage(), tracker.attempts(id), since(start));
        }

        tracker.recordSuccess(id);
        Duration elapsed = since(start);
        log.debug("Stored embedding for {} ({} ms)", id, elapsed.toMillis());
        return ComputeResult.computed(stored, elapsed);
    }

    private ComputeResult recordFailure(String id, FailureKind kind, String message, long start) {
        int attempts = context.getFailureTracker().recordFailure(id);
        log.warn("Failed to compute embedding for {} ({}, attempt {}/{}): {}",
                id, kind, attempts, context.getFailureTracker().getMaxRetries(), message);
        return ComputeResult.failed(id, kind, message, attempts, since(start));
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
