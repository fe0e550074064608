package com.example.photoindex.scan;

import com.example.photoindex.IndexContext;
import com.example.photoindex.compute.ComputeResult;
import com.example.photoindex.compute.EmbeddingResolver;
import com.example.photoindex.metadata.MetadataStore;
import com.example.photoindex.model.PhotoRef;
import com.example.photoindex.source.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Brings the embedding store up to date with photos created after the persisted watermark.
 *
 * <p>Photos are visited newest first. When a run completes, the watermark moves to the creation time of
 * the oldest photo the run processed, so an interrupted or partial run can only cause some photos to be
 * scanned again, never skipped. It stays below any photo that failed with retries left. A cancelled run
 * leaves the watermark where it was.</p>
 *
 * <p>Failed photos never abort the run. Cancellation is checked between photos only; an extraction
 * in progress always finishes.</p>
 */
public class IncrementalScanner {

    private static final Logger log = LoggerFactory.getLogger(IncrementalScanner.class);

    private final IndexContext context;
    private final EmbeddingResolver resolver;

    public IncrementalScanner(IndexContext context, EmbeddingResolver resolver) {
        if (context == null || resolver == null) {
            throw new IllegalArgumentException("context and resolver are required");
        }
        this.context = context;
        this.resolver = resolver;
    }

    public ScanReport run(ProgressListener progress) {
        return run(progress, () -> false);
    }

    public ScanReport run(ProgressListener progress, BooleanSupplier cancelRequested) {
        ProgressListener listener = progress != null ? progress : ProgressListener.NONE;
        MetadataStore metadata = context.getMetadata();
        long batchStart = System.nanoTime();

        Instant watermark = metadata.getWatermark().orElse(null);
        log.info("Current embedding watermark: {}", watermark != null ? watermark : "none");

        Predicate<PhotoRef> newerThanWatermark = watermark == null
                ? null
                : photo -> photo.getCreationTime().isAfter(watermark);
        List<PhotoRef> photos = context.getAssetSource().enumerate(SortKey.CREATION_TIME_DESCENDING, newerThanWatermark);
        int total = photos.size();

        if (total == 0) {
            log.info("No new photos to process since watermark");
            listener.onProgress(0, 0);
            return ScanReport.empty(watermark);
        }
        log.info("Found {} photos to process", total);

        int processed = 0;
        int cached = 0;
        int computed = 0;
        int failed = 0;
        int skippedPermanent = 0;
        boolean cancelled = false;
        Instant oldestProcessed = null;
        Instant oldestRetryable = null;
        Duration computeTime = Duration.ZERO;
        int yieldEvery = context.getConfig().getYieldEvery();

        for (PhotoRef photo : photos) {
            if (cancelRequested.getAsBoolean()) {
                cancelled = true;
                log.info("Scan cancelled after {}/{} photos", processed, total);
                break;
            }

            ComputeResult result = resolver.resolve(photo);
            processed++;

            switch (result.getStatus()) {
                case CACHED:
                    cached++;
                    break;
                case COMPUTED:
                    computed++;
                    computeTime = computeTime.plus(result.getElapsed());
                    log.debug("Processed {}/{}: {} ({} ms)", processed, total, photo.getId(),
                            result.getElapsed().toMillis());
                    break;
                case PERMANENTLY_FAILED:
                    skippedPermanent++;
                    break;
                case FAILED:
                default:
                    failed++;
                    log.debug("Failed {}/{}: {} ({})", processed, total, photo.getId(), result.getFailureKind());
                    break;
            }

            Instant created = photo.getCreationTime();
            if (result.getStatus() == ComputeResult.Status.FAILED) {
                if (oldestRetryable == null || created.isBefore(oldestRetryable)) {
                    oldestRetryable = created;
                }
            } else if (oldestProcessed == null || created.isBefore(oldestProcessed)) {
                oldestProcessed = created;
            }

            listener.onProgress(processed, total);

            if (processed % yieldEvery == 0) {
                Thread.yield();
            }
        }

        Instant newWatermark = watermark;
        Instant candidate = oldestProcessed;
        // Retryable failures must stay above the watermark so the next run sees them again.
        if (candidate != null && oldestRetryable != null && !candidate.isBefore(oldestRetryable)) {
            candidate = oldestRetryable.minusNanos(1);
        }
        if (!cancelled && candidate != null
                && (watermark == null || candidate.isAfter(watermark))) {
            newWatermark = candidate;
            metadata.setWatermark(newWatermark);
            log.info("Updated embedding watermark to: {}", newWatermark);
        }
        listener.onProgress(processed, total);

        ScanReport report = new ScanReport(total, processed, cached, computed, failed, skippedPermanent,
                cancelled, watermark, newWatermark, Duration.ofNanos(System.nanoTime() - batchStart), computeTime);
        logStats(report);
        return report;
    }

    /** Forces the next run to visit the whole library. */
    public void resetWatermark() {
        context.getMetadata().clearWatermark();
        log.info("Reset embedding watermark - next scan will process all photos");
    }

    private void logStats(ScanReport report) {
        log.info("================= BATCH EMBEDDING STATS =================");
        log.info("Total batch time: {} seconds", seconds(report.getElapsed()));
        log.info("Photos processed: {}/{}", report.getProcessed(), report.getTotal());
        log.info("Embeddings computed: {} (cached {}, failed {})",
                report.getComputed(), report.getCached(), report.getFailed());
        int permanent = context.getFailureTracker().permanentFailureCount();
        log.info("Permanently failed photos: {}", permanent);
        if (permanent > 0) {
            log.info("Failed photo ids: {}...", String.join(", ", context.getFailureTracker().permanentlyFailedIds(5)));
        }
        if (report.getComputed() > 0) {
            log.info("Average embedding computation time: {} seconds", seconds(report.getAverageComputeTime()));
            log.info("Total compute time: {} seconds", seconds(report.getComputeTime()));
            log.info("Overhead time: {} seconds", seconds(report.getElapsed().minus(report.getComputeTime())));
        }
        log.info("=========================================================");
    }

    private static String seconds(Duration duration) {
        return String.format("%.3f", duration.toNanos() / 1e9);
    }
}
