package com.williamcallahan.setforge.service.provider;

import static com.williamcallahan.setforge.service.provider.ProviderTestFixtures.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.setforge.domain.provider.ProviderTier;
import com.williamcallahan.setforge.support.VirtualTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

/**
 * Verifies round-robin, cooldown-aware provider selection.
 */
class ProviderRegistryTest {

    private static final Duration NO_PROVIDER_SLEEP = Duration.ofSeconds(5);

    @Test
    void rotatesAcrossAvailableProviders() throws InterruptedException {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderRegistry registry = new ProviderRegistry(
                List.of(provider("a", ProviderTier.FREE, 100, time), provider("b", ProviderTier.FREE, 100, time)),
                new ProviderCooldownRegistry(time),
                NO_PROVIDER_SLEEP,
                time);

        List<String> picks = new ArrayList<>();
        for (int call = 0; call < 4; call++) {
            picks.add(registry.select(10).name());
        }

        assertEquals(List.of("a", "b", "a", "b"), picks);
    }

    @Test
    void paidProvidersAreOrderedFirst() {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderRegistry registry = new ProviderRegistry(
                List.of(
                        provider("free-1", ProviderTier.FREE, 10, time),
                        provider("paid", ProviderTier.PAID, 10, time),
                        provider("free-2", ProviderTier.FREE, 10, time)),
                new ProviderCooldownRegistry(time),
                NO_PROVIDER_SLEEP,
                time);

        List<String> order = new ArrayList<>();
        registry.providers().forEach(descriptor -> order.add(descriptor.name()));

        assertEquals(List.of("paid", "free-1", "free-2"), order);
        assertEquals("paid", registry.trySelect(10).orElseThrow().name());
    }

    @Test
    void providerInCooldownIsNeverSelected() throws InterruptedException {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderCooldownRegistry cooldowns = new ProviderCooldownRegistry(time);
        ProviderRegistry registry = new ProviderRegistry(
                List.of(provider("a", ProviderTier.PAID, 1_000, time), provider("b", ProviderTier.FREE, 1_000, time)),
                cooldowns,
                NO_PROVIDER_SLEEP,
                time);

        cooldowns.coolDown("a", Duration.ofSeconds(60));

        for (int call = 0; call < 100; call++) {
            assertEquals("b", registry.select(10).name());
        }
        assertTrue(time.sleeps().isEmpty());
    }

    @Test
    void providerAtRateLimitIsSkipped() throws InterruptedException {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderDescriptor limited = provider("a", ProviderTier.PAID, 1, time);
        ProviderRegistry registry = new ProviderRegistry(
                List.of(limited, provider("b", ProviderTier.FREE, 100, time)),
                new ProviderCooldownRegistry(time),
                NO_PROVIDER_SLEEP,
                time);
        limited.admissionGate().acquire(10);

        assertEquals("b", registry.select(10).name());
        assertEquals("b", registry.select(10).name());
    }

    @Test
    void sleepsAndRescansWhenEveryProviderIsUnavailable() throws InterruptedException {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderCooldownRegistry cooldowns = new ProviderCooldownRegistry(time);
        ProviderRegistry registry = new ProviderRegistry(
                List.of(provider("a", ProviderTier.FREE, 100, time)), cooldowns, NO_PROVIDER_SLEEP, time);
        cooldowns.coolDown("a", Duration.ofSeconds(12));

        ProviderDescriptor selected = registry.select(10);

        assertEquals("a", selected.name());
        assertEquals(List.of(NO_PROVIDER_SLEEP, NO_PROVIDER_SLEEP, NO_PROVIDER_SLEEP), time.sleeps());
    }

    @Test
    void trySelectReturnsEmptyWhenNothingIsAvailable() {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderCooldownRegistry cooldowns = new ProviderCooldownRegistry(time);
        ProviderRegistry registry = new ProviderRegistry(
                List.of(provider("a", ProviderTier.FREE, 100, time)), cooldowns, NO_PROVIDER_SLEEP, time);
        cooldowns.coolDown("a", Duration.ofSeconds(12));

        assertTrue(registry.trySelect(10).isEmpty());
    }

    @Test
    void emptyRegistryFailsSelection() {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderRegistry registry =
                new ProviderRegistry(List.of(), new ProviderCooldownRegistry(time), NO_PROVIDER_SLEEP, time);

        assertThrows(IllegalStateException.class, () -> registry.select(10));
    }

    @Test
    void selectionReservesTheCallOnTheChosenProvider() {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderDescriptor single = provider("a", ProviderTier.FREE, 1, time);
        ProviderRegistry registry = new ProviderRegistry(
                List.of(single), new ProviderCooldownRegistry(time), NO_PROVIDER_SLEEP, time);

        assertEquals("a", registry.trySelect(10).orElseThrow().name());

        assertEquals(0, single.admissionGate().requestLimiter().availablePermits());
        assertFalse(single.admissionGate().canAdmit(10));
        assertTrue(registry.trySelect(10).isEmpty());
    }

    @Test
    void concurrentCallersNeverClaimTheSameFreeSlot() throws Exception {
        VirtualTime time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        ProviderRegistry registry = new ProviderRegistry(
                List.of(provider("scarce", ProviderTier.PAID, 1, time), provider("roomy", ProviderTier.FREE, 1_000, time)),
                new ProviderCooldownRegistry(time),
                NO_PROVIDER_SLEEP,
                time);
        int callers = 16;
        Callable<String> selectOnce = () -> registry.select(10).name();
        List<Callable<String>> selections = Collections.nCopies(callers, selectOnce);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<String> picks = new ArrayList<>();
        try {
            for (Future<String> pick : pool.invokeAll(selections)) {
                picks.add(pick.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, Collections.frequency(picks, "scarce"));
        assertEquals(callers - 1, Collections.frequency(picks, "roomy"));
        assertTrue(time.sleeps().isEmpty());
    }
}
