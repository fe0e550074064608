package com.example.photoindex.failure;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FailureTrackerTest {

    @Test
    void becomesPermanentAtTheCap() {
        FailureTracker tracker = new FailureTracker(3);

        assertThat(tracker.recordFailure("a")).isEqualTo(1);
        assertThat(tracker.recordFailure("a")).isEqualTo(2);
        assertThat(tracker.isPermanentlyFailed("a")).isFalse();
        assertThat(tracker.recordFailure("a")).isEqualTo(3);
        assertThat(tracker.isPermanentlyFailed("a")).isTrue();
        assertThat(tracker.permanentFailureCount()).isEqualTo(1);
    }

    @Test
    void successClearsTheCounter() {
        FailureTracker tracker = new FailureTracker(3);
        tracker.recordFailure("a");
        tracker.recordFailure("a");

        tracker.recordSuccess("a");

        assertThat(tracker.attempts("a")).isZero();
        tracker.recordFailure("a");
        tracker.recordFailure("a");
        assertThat(tracker.isPermanentlyFailed("a")).isFalse();
    }

    @Test
    void successDoesNotLiftPermanentFailure() {
        FailureTracker tracker = new FailureTracker(1);
        tracker.recordFailure("a");

        tracker.recordSuccess("a");

        assertThat(tracker.isPermanentlyFailed("a")).isTrue();
    }

    @Test
    void clearAllResetsEverything() {
        FailureTracker tracker = new FailureTracker(2);
        tracker.recordFailure("a");
        tracker.recordFailure("a");
        tracker.recordFailure("b");

        tracker.clearAll();

        assertThat(tracker.isPermanentlyFailed("a")).isFalse();
        assertThat(tracker.attempts("b")).isZero();
        assertThat(tracker.permanentFailureCount()).isZero();
    }

    @Test
    void listsPermanentFailuresUpToLimit() {
        FailureTracker tracker = new FailureTracker(1);
        for (int i = 0; i < 10; i++) {
            tracker.recordFailure("p" + i);
        }
        tracker.recordFailure("x");

        assertThat(tracker.permanentlyFailedIds(5)).hasSize(5);
        assertThat(tracker.permanentlyFailedIds(100)).hasSize(11);
    }

    @Test
    void permanentCountFollowsPromotionsAndClearAll() {
        FailureTracker tracker = new FailureTracker(2);
        tracker.recordFailure("a");
        assertThat(tracker.permanentFailureCount()).isZero();

        tracker.recordFailure("a");
        tracker.recordFailure("a");
        tracker.recordFailure("b");
        tracker.recordFailure("b");
        tracker.recordSuccess("b");
        tracker.recordFailure("c");
        assertThat(tracker.permanentFailureCount()).isEqualTo(2);
        assertThat(tracker.permanentlyFailedIds(5)).containsExactly("a", "b");

        tracker.clearAll();
        assertThat(tracker.permanentFailureCount()).isZero();
        assertThat(tracker.permanentlyFailedIds(5)).isEmpty();

        tracker.recordFailure("c");
        assertThat(tracker.permanentFailureCount()).isEqualTo(1);
        assertThat(tracker.permanentlyFailedIds(5)).containsExactly("c");
    }

    @Test
    void failedIdSampleIsBoundedButCountIsNot() {
        FailureTracker tracker = new FailureTracker(1);
        int total = FailureTracker.FAILED_ID_SAMPLE_SIZE + 30;
        for (int i = 0; i < total; i++) {
            tracker.recordFailure("p" + i);
        }

        assertThat(tracker.permanentFailureCount()).isEqualTo(total);
        assertThat(tracker.permanentlyFailedIds(1000)).hasSize(FailureTracker.FAILED_ID_SAMPLE_SIZE)
                .startsWith("p0", "p1");
        assertThat(tracker.permanentlyFailedIds(0)).isEmpty();
    }

    @Test
    void concurrentFailuresAreAllCounted() throws Exception {
        FailureTracker tracker = new FailureTracker(1000);
        Thread[] threads = new Thread[4];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    tracker.recordFailure("shared");
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertThat(tracker.attempts("shared")).isEqualTo(400);
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new FailureTracker(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
