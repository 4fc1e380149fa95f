package com.williamcallahan.setforge.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Provider selection timing, bound from {@code app.selection}.
 */
public class SelectionSettings {

    private static final Duration NO_PROVIDER_SLEEP_DEF = Duration.ofSeconds(5);
    private static final Duration DEFAULT_COOLDOWN_DEF = Duration.ofSeconds(60);
    private static final Duration RATE_WINDOW_DEF = Duration.ofSeconds(60);
    private static final String NO_PROVIDER_SLEEP_KEY = "app.selection.no-provider-sleep";
    private static final String DEFAULT_COOLDOWN_KEY = "app.selection.default-cooldown";
    private static final String RATE_WINDOW_KEY = "app.selection.rate-window";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private Duration noProviderSleep = NO_PROVIDER_SLEEP_DEF;
    private Duration defaultCooldown = DEFAULT_COOLDOWN_DEF;
    private Duration rateWindow = RATE_WINDOW_DEF;

    public SelectionSettings() {}

    /**
     * Validates selection settings.
     */
    public void validateConfiguration() {
        requirePositiveDuration(NO_PROVIDER_SLEEP_KEY, noProviderSleep);
        requirePositiveDuration(DEFAULT_COOLDOWN_KEY, defaultCooldown);
        requirePositiveDuration(RATE_WINDOW_KEY, rateWindow);
    }

    private static void requirePositiveDuration(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    /**
     * Returns how long selection sleeps when no provider is available before rescanning.
     *
     * @return sleep between full scans
     */
    public Duration getNoProviderSleep() {
        return noProviderSleep;
    }

    public void setNoProviderSleep(final Duration noProviderSleep) {
        this.noProviderSleep = noProviderSleep;
    }

    /**
     * Returns the cooldown applied to a throttled provider that sent no retry hint.
     *
     * @return fallback cooldown
     */
    public Duration getDefaultCooldown() {
        return defaultCooldown;
    }

    public void setDefaultCooldown(final Duration defaultCooldown) {
        this.defaultCooldown = defaultCooldown;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public void setRateWindow(final Duration rateWindow) {
        this.rateWindow = rateWindow;
    }
}
