package com.williamcallahan.setforge.service.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt budget and exponential backoff for one work item.
 *
 * @param maxAttempts total attempts, including the first
 * @param baseDelay backoff after the first failed attempt
 * @param maxBackoff upper bound on any single backoff
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxBackoff) {
    private static final int MAX_SHIFT = 30;

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be non-negative");
        }
    }

    /**
     * Backoff after the zero-based {@code attempt} failed: {@code baseDelay * 2^attempt}, capped.
     */
    public Duration backoffAfter(int attempt) {
        Duration backoff = baseDelay.multipliedBy(1L << Math.min(Math.max(attempt, 0), MAX_SHIFT));
        return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
    }
}
