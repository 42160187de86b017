package com.example.treeinventory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Adaptive timer for the combined progress/checkpoint occasion. After each occasion the next
 * interval becomes one minute if the callback was cheap (under two seconds), otherwise 25 times
 * its cost, keeping checkpoint overhead near 1/25 of the run. Workers that find another worker
 * mid-occasion skip the check instead of waiting.
 */
public final class OccasionThrottle {
    static final Duration INITIAL_INTERVAL = Duration.ofSeconds(10);
    static final Duration CHEAP_OCCASION = Duration.ofSeconds(2);
    static final Duration CHEAP_INTERVAL = Duration.ofSeconds(60);
    static final int COST_MULTIPLIER = 25;

    private final Runnable occasion;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile long lastOccasion;
    private volatile long betweenOccasions;

    public OccasionThrottle(Runnable occasion) {
        this(occasion, System::nanoTime);
    }

    OccasionThrottle(Runnable occasion, LongSupplier nanoClock) {
        this.occasion = occasion;
        this.nanoClock = nanoClock;
        this.lastOccasion = nanoClock.getAsLong();
        this.betweenOccasions = INITIAL_INTERVAL.toNanos();
    }

    /**
     * Fires the occasion if the current interval has elapsed and no other thread is firing it.
     * Never blocks.
     */
    public boolean maybeFire() {
        if (!due()) {
            return false;
        }
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (!due()) {
                return false;
            }
            fire();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Duration currentInterval() {
        return Duration.ofNanos(betweenOccasions);
    }

    private boolean due() {
        return nanoClock.getAsLong() - lastOccasion > betweenOccasions;
    }

    private void fire() {
        long start = nanoClock.getAsLong();
        lastOccasion = start;
        occasion.run();
        long cost = nanoClock.getAsLong() - start;
        betweenOccasions = cost < CHEAP_OCCASION.toNanos() ? CHEAP_INTERVAL.toNanos() : cost * COST_MULTIPLIER;
    }
}
