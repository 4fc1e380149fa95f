package com.williamcallahan.setforge.service.provider;

import com.williamcallahan.setforge.domain.provider.ProviderTier;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.ratelimit.ProviderAdmissionGate;
import com.williamcallahan.setforge.support.VirtualTime;
import java.time.Duration;

/**
 * Builds provider descriptors backed by a virtual clock.
 */
public final class ProviderTestFixtures {

    private ProviderTestFixtures() {}

    public static ProviderDescriptor provider(String name, ProviderTier tier, int rpm, VirtualTime time) {
        return provider(name, TransportKind.OPENAI_COMPATIBLE, tier, rpm, time);
    }

    public static ProviderDescriptor provider(
            String name, TransportKind kind, ProviderTier tier, int rpm, VirtualTime time) {
        ProviderAdmissionGate gate =
                ProviderAdmissionGate.create(name, rpm, 1_000_000, Duration.ofSeconds(60), time, time);
        return new ProviderDescriptor(name, kind, name + "-model", name.toUpperCase() + "_KEY", null, tier, gate);
    }
}
