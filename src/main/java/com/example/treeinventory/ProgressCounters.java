package com.example.treeinventory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared entry counters updated by every branch computation.
 */
public final class ProgressCounters {
    private final AtomicLong totalFiles = new AtomicLong();
    private final AtomicLong filesDone = new AtomicLong();

    public void addDiscovered(int entries) {
        totalFiles.addAndGet(entries);
    }

    public void entryDone() {
        filesDone.incrementAndGet();
    }

    public long totalFiles() {
        return totalFiles.get();
    }

    public long filesDone() {
        return filesDone.get();
    }
}
