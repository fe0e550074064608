package com.example.photoindex.failure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-photo retry bookkeeping shared by interactive and batch callers.
 *
 * <p>One map holds both the attempt counter and the permanent flag; the permanent count and a small
 * sample of permanently failed ids are kept alongside it. Every method takes the same lock
 * and does only O(1) map work inside it, so callers must record outcomes after extraction or I/O, never
 * while holding anything of their own.</p>
 */
public class FailureTracker {

    private static final Logger log = LoggerFactory.getLogger(FailureTracker.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Permanently failed ids kept for diagnostics. */
    public static final int FAILED_ID_SAMPLE_SIZE = 20;

    private final int maxRetries;
    private final Map<String, FailureState> states = new HashMap<>();
    private final List<String> failedIdSample = new ArrayList<>();
    private int permanentCount;
    private final Object lock = new Object();

    public FailureTracker() {
        this(DEFAULT_MAX_RETRIES);
    }

    public FailureTracker(int maxRetries) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        this.maxRetries = maxRetries;
    }

    /**
     * Counts one more failed attempt. Once the count reaches the cap the photo is permanently failed.
     *
     * @return the attempt count after this failure
     */
    public int recordFailure(String id) {
        int attempts;
        boolean promoted;
        synchronized (lock) {
            FailureState state = states.computeIfAbsent(id, k -> new FailureState());
            state.attempts++;
            promoted = !state.permanentlyFailed && state.attempts >= maxRetries;
            if (promoted) {
                state.permanentlyFailed = true;
                permanentCount++;
                if (failedIdSample.size() < FAILED_ID_SAMPLE_SIZE) {
                    failedIdSample.add(id);
                }
            }
            attempts = state.attempts;
        }

        if (promoted) {
            log.warn("Photo {} failed {} times, marking as permanently failed", id, attempts);
        } else {
            log.debug("Photo {} failed (attempt {}/{})", id, attempts, maxRetries);
        }
        return attempts;
    }

    /**
     * Resets the attempt counter. A permanent failure is left in place; only {@link #clearAll()} lifts it.
     */
    public void recordSuccess(String id) {
        synchronized (lock) {
            FailureState state = states.get(id);
            if (state == null) {
                return;
            }
            if (state.permanentlyFailed) {
                state.attempts = 0;
            } else {
                states.remove(id);
            }
        }
    }

    public boolean isPermanentlyFailed(String id) {
        synchronized (lock) {
            FailureState state = states.get(id);
            return state != null && state.permanentlyFailed;
        }
    }

    public int attempts(String id) {
        synchronized (lock) {
            FailureState state = states.get(id);
            return state == null ? 0 : state.attempts;
        }
    }

    public int permanentFailureCount() {
        synchronized (lock) {
            return permanentCount;
        }
    }

    /**
     * Up to {@code limit} permanently failed ids, for diagnostics. Only the first
     * {@value #FAILED_ID_SAMPLE_SIZE} promotions since the last {@link #clearAll()} are remembered.
     */
    public List<String> permanentlyFailedIds(int limit) {
        synchronized (lock) {
            return new ArrayList<>(failedIdSample.subList(0, Math.max(0, Math.min(limit, failedIdSample.size()))));
        }
    }

    /**
     * Forgets every failure so previously failed photos are attempted again.
     */
    public void clearAll() {
        synchronized (lock) {
            states.clear();
            failedIdSample.clear();
            permanentCount = 0;
        }
        log.info("Cleared all failure tracking - previously failed photos can be retried");
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private static final class FailureState {
        int attempts;
        boolean permanentlyFailed;
    }
}
