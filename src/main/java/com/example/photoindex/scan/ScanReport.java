package com.example.photoindex.scan;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Summary of one incremental scan run.
 */
public final class ScanReport {
    private final int total;
    private final int processed;
    private final int cached;
    private final int computed;
    private final int failed;
    private final int skippedPermanent;
    private final boolean cancelled;
    private final Instant watermarkBefore;
    private final Instant watermarkAfter;
    private final Duration elapsed;
    private final Duration computeTime;

    ScanReport(int total, int processed, int cached, int computed, int failed, int skippedPermanent,
               boolean cancelled, Instant watermarkBefore, Instant watermarkAfter,
               Duration elapsed, Duration computeTime) {
        this.total = total;
        this.processed = processed;
        this.cached = cached;
        this.computed = computed;
        this.failed = failed;
        this.skippedPermanent = skippedPermanent;
        this.cancelled = cancelled;
        this.watermarkBefore = watermarkBefore;
        this.watermarkAfter = watermarkAfter;
        this.elapsed = elapsed;
        this.computeTime = computeTime;
    }

    static ScanReport empty(Instant watermark) {
        return new ScanReport(0, 0, 0, 0, 0, 0, false, watermark, watermark, Duration.ZERO, Duration.ZERO);
    }

    public int getTotal() {
        return total;
    }

    public int getProcessed() {
        return processed;
    }

    public int getCached() {
        return cached;
    }

    public int getComputed() {
        return computed;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkippedPermanent() {
        return skippedPermanent;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<Instant> getWatermarkBefore() {
        return Optional.ofNullable(watermarkBefore);
    }

    public Optional<Instant> getWatermarkAfter() {
        return Optional.ofNullable(watermarkAfter);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /** Time spent decoding and extracting, summed over computed photos. */
    public Duration getComputeTime() {
        return computeTime;
    }

    public Duration getAverageComputeTime() {
        return computed == 0 ? Duration.ZERO : computeTime.dividedBy(computed);
    }

    @Override
    public String toString() {
        return "ScanReport{processed=" + processed + "/" + total + ", cached=" + cached
                + ", computed=" + computed + ", failed=" + failed + ", skippedPermanent=" + skippedPermanent
                + (cancelled ? ", cancelled" : "") + ", watermark=" + watermarkAfter + "}";
    }
}
