package com.williamcallahan.setforge.domain.provider;

import java.util.Locale;

/**
 * Priority class of a provider; lower priority values are scanned first.
 */
public enum ProviderTier {
    PAID(0),
    FREE(1);

    private final int priority;

    ProviderTier(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    /**
     * Parses a configured tier name; a blank value means {@link #FREE}.
     *
     * @param setting configured tier
     * @return parsed tier
     */
    public static ProviderTier fromSetting(String setting) {
        if (setting == null || setting.isBlank()) {
            return FREE;
        }
        try {
            return valueOf(setting.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknownTier) {
            throw new IllegalArgumentException("Unknown provider tier: " + setting, unknownTier);
        }
    }
}
