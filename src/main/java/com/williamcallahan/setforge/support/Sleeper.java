package com.williamcallahan.setforge.support;

import java.time.Duration;

/**
 * Blocks the calling thread for a duration.
 *
 * <p>Rate limiters, provider selection and retry backoff sleep through this seam so tests
 * can advance a virtual clock instead of waiting on the wall clock.</p>
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps with {@link Thread#sleep(long)}; sub-millisecond waits round up to one millisecond. */
    Sleeper SYSTEM = duration -> {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        Thread.sleep(Math.max(1L, duration.toMillis()));
    };

    /**
     * Sleeps for the given duration.
     *
     * @param duration how long to block; zero or negative returns immediately
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;
}
