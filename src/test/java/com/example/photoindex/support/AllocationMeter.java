package com.example.photoindex.support;

import java.lang.management.ManagementFactory;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Heap bytes allocated by the current thread while running an action. Skips the calling test on JVMs
 * that do not report per-thread allocation.
 */
public final class AllocationMeter {

    private AllocationMeter() {}

    public static long bytesAllocatedBy(Runnable action) {
        java.lang.management.ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        assumeTrue(bean instanceof com.sun.management.ThreadMXBean, "no per-thread allocation counter");
        com.sun.management.ThreadMXBean threads = (com.sun.management.ThreadMXBean) bean;
        assumeTrue(threads.isThreadAllocatedMemorySupported() && threads.isThreadAllocatedMemoryEnabled(),
                "per-thread allocation counter disabled");

        long threadId = Thread.currentThread().getId();
        long before = threads.getThreadAllocatedBytes(threadId);
        action.run();
        return threads.getThreadAllocatedBytes(threadId) - before;
    }
}
