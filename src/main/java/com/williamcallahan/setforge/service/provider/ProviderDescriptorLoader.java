package com.williamcallahan.setforge.service.provider;

import com.williamcallahan.setforge.config.ProviderSettings;
import com.williamcallahan.setforge.domain.provider.ProviderTier;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.ratelimit.ProviderAdmissionGate;
import com.williamcallahan.setforge.support.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns bound provider settings into descriptors with their own admission gates.
 */
public class ProviderDescriptorLoader {
    private static final Logger log = LoggerFactory.getLogger(ProviderDescriptorLoader.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public ProviderDescriptorLoader(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Builds descriptors in configuration order.
     *
     * @param settings validated provider settings
     * @param rateWindow window shared by every provider's request and token limiters
     * @throws IllegalArgumentException for an unknown transport kind or tier
     */
    public List<ProviderDescriptor> load(List<ProviderSettings> settings, Duration rateWindow) {
        List<ProviderDescriptor> descriptors = new ArrayList<>(settings.size());
        for (ProviderSettings entry : settings) {
            TransportKind kind = TransportKind.fromSetting(entry.getTransportKind());
            ProviderTier tier = ProviderTier.fromSetting(entry.getTier());
            ProviderAdmissionGate gate = ProviderAdmissionGate.create(
                    entry.getName(),
                    entry.getRequestsPerMinute(),
                    entry.getTokensPerMinute(),
                    rateWindow,
                    clock,
                    sleeper);
            descriptors.add(new ProviderDescriptor(
                    entry.getName(),
                    kind,
                    entry.getModel(),
                    entry.getCredentialRef(),
                    entry.getBaseUrl(),
                    tier,
                    gate));
            log.info(
                    "[PROVIDER] Registered {} ({}, model={}, tier={}, rpm={}, tpm={})",
                    entry.getName(),
                    kind,
                    entry.getModel(),
                    tier,
                    entry.getRequestsPerMinute(),
                    entry.getTokensPerMinute());
        }
        return descriptors;
    }
}
