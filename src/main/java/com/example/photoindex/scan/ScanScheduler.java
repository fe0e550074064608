package com.example.photoindex.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs incremental scans in the background, one at a time, on a minimum-priority daemon thread so
 * interactive queries keep the CPU.
 */
public class ScanScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

    /** How long {@link #close()} waits for a cancelled scan to finish its current photo. */
    public static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final IncrementalScanner scanner;
    private final ExecutorService executor;
    private final Object lock = new Object();

    private Future<ScanReport> running;
    private AtomicBoolean cancelFlag = new AtomicBoolean();

    public ScanScheduler(IncrementalScanner scanner) {
        if (scanner == null) {
            throw new IllegalArgumentException("scanner cannot be null");
        }
        this.scanner = scanner;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "photo-index-scan");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            return thread;
        });
    }

    /**
     * Starts a scan unless one is already running, in which case the running scan is returned.
     */
    public Future<ScanReport> requestScan(ProgressListener progress) {
        synchronized (lock) {
            if (running != null && !running.isDone()) {
                log.debug("Scan already running, keeping it");
                return running;
            }
            AtomicBoolean flag = new AtomicBoolean();
            cancelFlag = flag;
            running = executor.submit(() -> scanner.run(progress, flag::get));
            log.info("Background scan started");
            return running;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running != null && !running.isDone();
        }
    }

    /**
     * Asks the running scan to stop after its current photo. No effect when idle.
     */
    public void cancel() {
        synchronized (lock) {
            cancelFlag.set(true);
        }
    }

    /**
     * Cancels any running scan and waits for it to stop.
     */
    @Override
    public void close() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Background scan did not stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the background scan to stop");
        }
    }
}
