package com.example.photoindex.scan;

/**
 * Receives scan progress. Called at least once per processed photo and once when a run completes,
 * on the scanning thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    void onProgress(int processed, int total);
}
