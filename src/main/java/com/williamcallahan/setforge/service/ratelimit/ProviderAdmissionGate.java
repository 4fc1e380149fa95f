package com.williamcallahan.setforge.service.ratelimit;

import com.williamcallahan.setforge.support.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Request and token rate limits of one provider, acquired together.
 *
 * <p>A call is admitted only when both the requests-per-window and tokens-per-window limiters have
 * room, and then both record it. Locks are always taken request limiter first, so two gates can
 * never deadlock on each other.</p>
 */
public final class ProviderAdmissionGate {
    private final SlidingWindowRateLimiter requestLimiter;
    private final SlidingWindowRateLimiter tokenLimiter;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * Creates a gate over two limiters that must share {@code clock}.
     */
    public ProviderAdmissionGate(
            SlidingWindowRateLimiter requestLimiter,
            SlidingWindowRateLimiter tokenLimiter,
            Clock clock,
            Sleeper sleeper) {
        this.requestLimiter = Objects.requireNonNull(requestLimiter, "requestLimiter");
        this.tokenLimiter = Objects.requireNonNull(tokenLimiter, "tokenLimiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Builds a gate with request and token limiters sharing one window.
     *
     * @param providerName provider the limits belong to
     * @param requestsPerWindow request budget
     * @param tokensPerWindow token budget
     * @param window rolling window, one minute in production
     */
    public static ProviderAdmissionGate create(
            String providerName,
            long requestsPerWindow,
            long tokensPerWindow,
            Duration window,
            Clock clock,
            Sleeper sleeper) {
        SlidingWindowRateLimiter requests =
                new SlidingWindowRateLimiter(providerName + "-rpm", requestsPerWindow, window, clock, sleeper);
        SlidingWindowRateLimiter tokens =
                new SlidingWindowRateLimiter(providerName + "-tpm", tokensPerWindow, window, clock, sleeper);
        return new ProviderAdmissionGate(requests, tokens, clock, sleeper);
    }

    /**
     * Returns whether a call of {@code estimatedTokens} would be admitted now.
     */
    public boolean canAdmit(long estimatedTokens) {
        long tokens = tokenLimiter.normalize(estimatedTokens);
        lockBoth();
        try {
            Instant now = clock.instant();
            return requestLimiter.hasRoom(1, now) && tokenLimiter.hasRoom(tokens, now);
        } finally {
            unlockBoth();
        }
    }

    /**
     * Records a call of {@code estimatedTokens} in both limiters if both have room now.
     *
     * @return false, recording nothing, when either limiter is full
     */
    public boolean tryAcquire(long estimatedTokens) {
        long tokens = tokenLimiter.normalize(estimatedTokens);
        lockBoth();
        try {
            Instant now = clock.instant();
            if (!requestLimiter.hasRoom(1, now) || !tokenLimiter.hasRoom(tokens, now)) {
                return false;
            }
            requestLimiter.record(1, now);
            tokenLimiter.record(tokens, now);
            return true;
        } finally {
            unlockBoth();
        }
    }

    /**
     * Blocks until both limiters have room, then records the call in both.
     *
     * @param estimatedTokens token weight of the call
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire(long estimatedTokens) throws InterruptedException {
        long tokens = tokenLimiter.normalize(estimatedTokens);
        while (true) {
            Duration wait;
            lockBoth();
            try {
                Instant now = clock.instant();
                boolean requestRoom = requestLimiter.hasRoom(1, now);
                boolean tokenRoom = tokenLimiter.hasRoom(tokens, now);
                if (requestRoom && tokenRoom) {
                    requestLimiter.record(1, now);
                    tokenLimiter.record(tokens, now);
                    return;
                }
                wait = Duration.ZERO;
                if (!requestRoom) {
                    wait = requestLimiter.waitFor(1, now);
                }
                if (!tokenRoom) {
                    Duration tokenWait = tokenLimiter.waitFor(tokens, now);
                    wait = tokenWait.compareTo(wait) > 0 ? tokenWait : wait;
                }
            } finally {
                unlockBoth();
            }
            sleeper.sleep(wait);
        }
    }

    public SlidingWindowRateLimiter requestLimiter() {
        return requestLimiter;
    }

    public SlidingWindowRateLimiter tokenLimiter() {
        return tokenLimiter;
    }

    private void lockBoth() {
        requestLimiter.lock().lock();
        tokenLimiter.lock().lock();
    }

    private void unlockBoth() {
        tokenLimiter.lock().unlock();
        requestLimiter.lock().unlock();
    }
}
