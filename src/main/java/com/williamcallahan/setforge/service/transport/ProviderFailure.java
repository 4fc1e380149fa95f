package com.williamcallahan.setforge.service.transport;

import com.williamcallahan.setforge.domain.generation.FailureCategory;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A categorized provider failure.
 *
 * @param category failure category
 * @param retryAfter provider-supplied retry hint, or null when absent
 * @param detail short description for logs and dead-letter reasons
 */
public record ProviderFailure(FailureCategory category, Duration retryAfter, String detail) {
    public ProviderFailure {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(detail, "detail");
    }

    static ProviderFailure of(FailureCategory category, String detail) {
        return new ProviderFailure(category, null, detail);
    }

    public Optional<Duration> retryHint() {
        return Optional.ofNullable(retryAfter);
    }
}
