package com.williamcallahan.setforge.config;

import com.williamcallahan.setforge.service.provider.ProviderCooldownRegistry;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import com.williamcallahan.setforge.service.provider.ProviderDescriptorLoader;
import com.williamcallahan.setforge.service.provider.ProviderRegistry;
import com.williamcallahan.setforge.support.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the provider pool and the time, sleep and metrics seams shared by the orchestration layer.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Builds the provider pool once at startup from {@code app.providers}.
     */
    @Bean
    public ProviderRegistry providerRegistry(
            AppProperties appProperties, ProviderCooldownRegistry cooldownRegistry, Clock clock, Sleeper sleeper) {
        SelectionSettings selection = appProperties.getSelection();
        List<ProviderDescriptor> descriptors = new ProviderDescriptorLoader(clock, sleeper)
                .load(appProperties.getProviders(), selection.getRateWindow());
        return new ProviderRegistry(descriptors, cooldownRegistry, selection.getNoProviderSleep(), sleeper);
    }
}
