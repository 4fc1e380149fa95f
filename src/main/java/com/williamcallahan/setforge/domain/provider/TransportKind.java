package com.williamcallahan.setforge.domain.provider;

import java.util.Locale;

/**
 * Wire protocols a provider can be reached through.
 *
 * The kind is fixed when provider configuration is loaded and selects the transport adapter
 * used for every call to that provider.
 */
public enum TransportKind {
    /** OpenAI chat completions API, also served by GitHub Models and DigitalOcean inference. */
    OPENAI_COMPATIBLE("https://api.openai.com/v1"),
    /** Google AI Studio {@code generateContent} REST API. */
    GOOGLE_AI_STUDIO("https://generativelanguage.googleapis.com/v1beta");

    private final String defaultBaseUrl;

    TransportKind(String defaultBaseUrl) {
        this.defaultBaseUrl = defaultBaseUrl;
    }

    /**
     * Base URL used when a provider does not configure its own endpoint.
     *
     * @return default base URL without a trailing slash
     */
    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    /**
     * Parses a configured transport name, accepting enum names and common aliases.
     *
     * @param setting configured value such as {@code openai}, {@code github_models} or {@code google-ai-studio}
     * @return the matching kind
     * @throws IllegalArgumentException when the value names no known transport
     */
    public static TransportKind fromSetting(String setting) {
        if (setting == null || setting.isBlank()) {
            throw new IllegalArgumentException("Transport kind must not be blank");
        }
        String normalized = setting.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "openai":
            case "openai_compatible":
            case "github_models":
            case "digitalocean":
                return OPENAI_COMPATIBLE;
            case "google_ai_studio":
            case "ai_studio":
                return GOOGLE_AI_STUDIO;
            default:
                throw new IllegalArgumentException("Unknown transport kind: " + setting);
        }
    }
}
