package com.williamcallahan.setforge.service.ratelimit;

import com.williamcallahan.setforge.support.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits at most {@code maxPermits} permits per rolling {@code period}.
 *
 * <p>Each admission is recorded with its timestamp and weight; capacity returns as admissions age
 * out of the window, so there is no explicit release. Expired admissions are pruned lazily on
 * every check. The check-and-record step runs under the limiter's lock and waiting happens outside
 * it, so a waiting thread never blocks other callers.</p>
 *
 * <p>A request weighing more than the whole window is clamped to the window size, which admits it
 * only into an otherwise empty window.</p>
 */
public final class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final String name;
    private final long maxPermits;
    private final Duration period;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Admission> admissions = new ArrayDeque<>();
    private long permitsInWindow;

    /**
     * Creates a limiter.
     *
     * @param name label used in log lines
     * @param maxPermits permits admitted per period
     * @param period rolling window length
     * @param clock time source
     * @param sleeper blocking strategy used while waiting for capacity
     */
    public SlidingWindowRateLimiter(String name, long maxPermits, Duration period, Clock clock, Sleeper sleeper) {
        this.name = Objects.requireNonNull(name, "name");
        this.period = Objects.requireNonNull(period, "period");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("maxPermits must be positive for limiter " + name);
        }
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive for limiter " + name);
        }
        this.maxPermits = maxPermits;
    }

    /**
     * Returns whether one permit could be admitted now without waiting.
     */
    public boolean canAdmit() {
        return canAdmit(1);
    }

    /**
     * Returns whether {@code permits} could be admitted now without waiting. Records nothing.
     */
    public boolean canAdmit(long permits) {
        long requested = normalize(permits);
        lock.lock();
        try {
            return hasRoom(requested, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until one permit fits in the window, then records it.
     */
    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Blocks until {@code permits} fit in the window, then records them.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire(long permits) throws InterruptedException {
        long requested = normalize(permits);
        while (true) {
            Duration wait;
            lock.lock();
            try {
                Instant now = clock.instant();
                if (hasRoom(requested, now)) {
                    record(requested, now);
                    return;
                }
                wait = waitFor(requested, now);
            } finally {
                lock.unlock();
            }
            log.debug("Limiter {} at capacity; waiting {}ms", name, wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    /**
     * Permits still available in the current window.
     */
    public long availablePermits() {
        lock.lock();
        try {
            prune(clock.instant());
            return maxPermits - permitsInWindow;
        } finally {
            lock.unlock();
        }
    }

    long normalize(long permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        if (permits > maxPermits) {
            log.debug("Limiter {} request of {} permits exceeds window size {}; clamping", name, permits, maxPermits);
            return maxPermits;
        }
        return permits;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Prunes and checks capacity. Caller must hold the lock.
     */
    boolean hasRoom(long permits, Instant now) {
        prune(now);
        return permitsInWindow + permits <= maxPermits;
    }

    /**
     * Records an admission. Caller must hold the lock and have checked {@link #hasRoom}.
     */
    void record(long permits, Instant now) {
        admissions.addLast(new Admission(now, permits));
        permitsInWindow += permits;
    }

    /**
     * Time until enough admissions age out for {@code permits} to fit. Caller must hold the lock.
     */
    Duration waitFor(long permits, Instant now) {
        long remaining = permitsInWindow;
        for (Admission admission : admissions) {
            remaining -= admission.permits();
            if (remaining + permits <= maxPermits) {
                Duration wait = Duration.between(now, admission.admittedAt().plus(period));
                return wait.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : wait;
            }
        }
        return MIN_WAIT;
    }

    private void prune(Instant now) {
        while (!admissions.isEmpty()) {
            Admission oldest = admissions.peekFirst();
            if (now.isBefore(oldest.admittedAt().plus(period))) {
                return;
            }
            admissions.removeFirst();
            permitsInWindow -= oldest.permits();
        }
    }

    private record Admission(Instant admittedAt, long permits) {}
}
