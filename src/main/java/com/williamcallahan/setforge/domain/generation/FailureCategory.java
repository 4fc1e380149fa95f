package com.williamcallahan.setforge.domain.generation;

/**
 * Taxonomy of provider call failures.
 */
public enum FailureCategory {
    /** Provider signalled throttling; the provider is cooled down. */
    RATE_LIMITED(true),
    /** Timeouts, connection resets, I/O errors and server-side errors. */
    TRANSIENT(true),
    /** The provider answered but the answer was empty or unusable. */
    MALFORMED_RESPONSE(true),
    /** Authentication, authorization or credential configuration problems. */
    FATAL(false);

    private final boolean retryable;

    FailureCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
