package com.example.treeinventory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed worker pool shared by every recursion level, with an admission budget of
 * {@code parallelism} in-flight asynchronous branches. A branch that is refused admission must
 * run inline on the caller's stack; with at most {@code parallelism} admitted tasks and as many
 * workers, an admitted task always gets a thread, so waiting parents cannot starve their children.
 */
public final class BranchScheduler implements AutoCloseable {
    private final int parallelism;
    private final ExecutorService pool;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public BranchScheduler(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.parallelism = parallelism;
        this.pool = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
    }

    /**
     * Reserves one asynchronous slot. Returns false when there is no pool or the budget is spent.
     */
    public boolean tryAdmit() {
        if (pool == null) {
            return false;
        }
        while (true) {
            int current = inFlight.get();
            if (current >= parallelism) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                peakInFlight.accumulateAndGet(current + 1, Math::max);
                return true;
            }
        }
    }

    /**
     * Runs an admitted branch on the pool; its slot is released when the branch finishes.
     */
    public <T> Future<T> submit(Callable<T> branch) {
        return pool.submit(() -> {
            try {
                return branch.call();
            } finally {
                inFlight.decrementAndGet();
            }
        });
    }

    public int parallelism() {
        return parallelism;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }

    @Override
    public void close() throws InterruptedException {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        pool.awaitTermination(1, TimeUnit.HOURS);
    }
}
