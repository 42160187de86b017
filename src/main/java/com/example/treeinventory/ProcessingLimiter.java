package com.example.treeinventory;

public interface ProcessingLimiter {
    /**
     * Returns true if no further branch should start once {@code finishedEntries} entries are done.
     */
    boolean shouldStop(long finishedEntries);

    /**
     * Default limiter used in production runs (never stops early).
     */
    ProcessingLimiter NO_LIMIT = finishedEntries -> false;
}
