package com.williamcallahan.setforge.service.provider;

import com.williamcallahan.setforge.support.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered pool of providers with round-robin, cooldown-aware selection.
 *
 * <p>Providers are ordered paid tier first, keeping configuration order within a tier. Each scan
 * starts at a rotating pointer and skips providers that are cooling down or whose limiters cannot
 * admit the call; the pointer moves past whichever provider is picked.</p>
 *
 * <p>Selecting a provider reserves one call of the estimated size in its rate limits, under the
 * same lock as the scan, so concurrent callers never pick the same free slot and a caller never
 * waits on a provider after selecting it.</p>
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<ProviderDescriptor> providers;
    private final ProviderCooldownRegistry cooldowns;
    private final Duration noProviderSleep;
    private final Sleeper sleeper;
    private final ReentrantLock rotationLock = new ReentrantLock();
    private int nextIndex;

    /**
     * Creates a registry.
     *
     * @param configured providers in configuration order
     * @param cooldowns shared cooldown state
     * @param noProviderSleep pause between full scans that found nothing
     * @param sleeper blocking strategy for that pause
     */
    public ProviderRegistry(
            List<ProviderDescriptor> configured,
            ProviderCooldownRegistry cooldowns,
            Duration noProviderSleep,
            Sleeper sleeper) {
        Objects.requireNonNull(configured, "configured");
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns");
        this.noProviderSleep = Objects.requireNonNull(noProviderSleep, "noProviderSleep");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        List<ProviderDescriptor> ordered = new ArrayList<>(configured);
        ordered.sort(Comparator.comparingInt(provider -> provider.tier().priority()));
        this.providers = List.copyOf(ordered);
        if (providers.isEmpty()) {
            log.warn("[PROVIDER] No providers configured; generation requests will fail");
        }
    }

    /**
     * Returns a provider with a call of {@code estimatedTokens} reserved, waiting as long as it takes.
     *
     * @throws IllegalStateException when no providers are configured
     * @throws InterruptedException if interrupted while waiting for a provider
     */
    public ProviderDescriptor select(long estimatedTokens) throws InterruptedException {
        if (providers.isEmpty()) {
            throw new IllegalStateException("No providers configured");
        }
        while (true) {
            Optional<ProviderDescriptor> selected = trySelect(estimatedTokens);
            if (selected.isPresent()) {
                return selected.get();
            }
            log.warn(
                    "[PROVIDER] All {} providers are cooling down or at capacity; retrying in {}ms",
                    providers.size(),
                    noProviderSleep.toMillis());
            sleeper.sleep(noProviderSleep);
        }
    }

    /**
     * Performs one scan without waiting, reserving the call on the provider it returns.
     *
     * @return the selected provider, or empty when every provider is unavailable
     */
    public Optional<ProviderDescriptor> trySelect(long estimatedTokens) {
        rotationLock.lock();
        try {
            int count = providers.size();
            for (int scanned = 0; scanned < count; scanned++) {
                int index = (nextIndex + scanned) % count;
                ProviderDescriptor candidate = providers.get(index);
                if (cooldowns.isCoolingDown(candidate.name())) {
                    log.debug("[PROVIDER] Skipping {}: cooling down", candidate.name());
                    continue;
                }
                if (!candidate.admissionGate().tryAcquire(estimatedTokens)) {
                    log.debug("[PROVIDER] Skipping {}: rate limit reached", candidate.name());
                    continue;
                }
                nextIndex = (index + 1) % count;
                return Optional.of(candidate);
            }
            return Optional.empty();
        } finally {
            rotationLock.unlock();
        }
    }

    public List<ProviderDescriptor> providers() {
        return providers;
    }

    public int size() {
        return providers.size();
    }
}
