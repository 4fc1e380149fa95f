package com.williamcallahan.setforge.service.retry;

import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import java.util.Optional;

/**
 * Result of processing one item under retries: either a value or a dead-letter entry.
 *
 * @param <T> value produced by a successful attempt
 */
public final class RetryResult<T> {
    private final T value;
    private final DeadLetterEntry deadLetter;
    private final int attempts;

    private RetryResult(T value, DeadLetterEntry deadLetter, int attempts) {
        this.value = value;
        this.deadLetter = deadLetter;
        this.attempts = attempts;
    }

    static <T> RetryResult<T> succeeded(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    static <T> RetryResult<T> deadLettered(DeadLetterEntry entry, int attempts) {
        return new RetryResult<>(null, entry, attempts);
    }

    public boolean succeeded() {
        return deadLetter == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<DeadLetterEntry> deadLetter() {
        return Optional.ofNullable(deadLetter);
    }

    public int attempts() {
        return attempts;
    }
}
