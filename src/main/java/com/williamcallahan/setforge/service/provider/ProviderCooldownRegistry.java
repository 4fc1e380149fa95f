package com.williamcallahan.setforge.service.provider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks when throttled providers may be called again.
 *
 * <p>A provider whose resume instant is in the future is never selected. A later cooldown never
 * shortens an earlier one still in force.</p>
 */
@Component
public class ProviderCooldownRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderCooldownRegistry.class);

    private final Map<String, Instant> resumeTimes = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProviderCooldownRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Excludes a provider from selection for {@code cooldown}.
     *
     * @return the instant the provider becomes selectable again
     */
    public Instant coolDown(String providerName, Duration cooldown) {
        Objects.requireNonNull(providerName, "providerName");
        Objects.requireNonNull(cooldown, "cooldown");
        Instant requested = clock.instant().plus(cooldown.isNegative() ? Duration.ZERO : cooldown);
        Instant effective = resumeTimes.merge(
                providerName, requested, (existing, candidate) -> existing.isAfter(candidate) ? existing : candidate);
        log.warn("[PROVIDER] {} cooling down for {}s (until {})", providerName, cooldown.toSeconds(), effective);
        return effective;
    }

    public boolean isCoolingDown(String providerName) {
        Instant resumeAt = resumeTimes.get(providerName);
        return resumeAt != null && clock.instant().isBefore(resumeAt);
    }

    /**
     * Time left until the provider is selectable, zero when it is not cooling down.
     */
    public Duration remaining(String providerName) {
        Instant resumeAt = resumeTimes.get(providerName);
        if (resumeAt == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), resumeAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
