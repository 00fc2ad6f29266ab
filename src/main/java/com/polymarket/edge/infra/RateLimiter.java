package com.polymarket.edge.infra;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by all callers of one HTTP client. Permits refill continuously at
 * {@code permitsPerSecond} and accumulate up to {@code maxBurst}, so an idle client may
 * send that many requests back to back before being paced.
 */
class RateLimiter {

    /** Parks the calling thread for the given number of nanoseconds. */
    interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final double permitsPerSecond;
    private final double maxBurst;
    private final LongSupplier ticker;
    private final Sleeper sleeper;

    // guarded by "this"
    private long lastRefill;
    private double storedPermits;

    RateLimiter(double permitsPerSecond, int maxBurst) {
        this(permitsPerSecond, maxBurst, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    RateLimiter(double permitsPerSecond, int maxBurst, LongSupplier ticker, Sleeper sleeper) {
        if (!(permitsPerSecond > 0)) {
            throw new IllegalArgumentException("permitsPerSecond must be positive: " + permitsPerSecond);
        }
        if (maxBurst < 1) {
            throw new IllegalArgumentException("maxBurst must be at least 1: " + maxBurst);
        }
        this.permitsPerSecond = permitsPerSecond;
        this.maxBurst = maxBurst;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.lastRefill = ticker.getAsLong();
        this.storedPermits = maxBurst;
    }

    /**
     * Blocks until a permit is available. The wait is reserved before sleeping, so
     * concurrent callers queue behind each other instead of waking together.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            refill();
            storedPermits -= 1.0;
            waitNanos = storedPermits >= 0 ? 0 : (long) (-storedPermits / permitsPerSecond * 1e9);
        }
        if (waitNanos > 0) {
            sleeper.sleep(waitNanos);
        }
    }

    /** Takes a permit only if one is available right now. */
    synchronized boolean tryAcquire() {
        refill();
        if (storedPermits >= 1.0) {
            storedPermits -= 1.0;
            return true;
        }
        return false;
    }

    synchronized double availablePermits() {
        refill();
        return Math.max(0, storedPermits);
    }

    private void refill() {
        long now = ticker.getAsLong();
        storedPermits = Math.min(maxBurst, storedPermits + (now - lastRefill) / 1e9 * permitsPerSecond);
        lastRefill = now;
    }
}
