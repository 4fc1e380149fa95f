package com.williamcallahan.setforge.config;

import java.util.Locale;

/**
 * One configured provider endpoint, bound from {@code app.providers[i]}.
 */
public class ProviderSettings {

    private static final String TIER_DEF = "free";
    private static final int RPM_DEF = 10;
    private static final int TPM_DEF = 100_000;
    private static final int MIN_POSITIVE = 1;
    private static final String KEY_FMT = "app.providers[%d].%s";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String name;
    private String transportKind;
    private String model;
    private String credentialRef;
    private String baseUrl;
    private String tier = TIER_DEF;
    private int requestsPerMinute = RPM_DEF;
    private int tokensPerMinute = TPM_DEF;

    public ProviderSettings() {}

    /**
     * Validates one provider entry.
     *
     * @param index position in the provider list, used in error messages
     */
    public void validateConfiguration(int index) {
        requireText(index, "name", name);
        requireText(index, "transport-kind", transportKind);
        requireText(index, "model", model);
        requireText(index, "credential-ref", credentialRef);
        requirePositive(index, "requests-per-minute", requestsPerMinute);
        requirePositive(index, "tokens-per-minute", tokensPerMinute);
    }

    private static void requireText(int index, String property, String value) {
        if (value == null || value.isBlank()) {
            String key = String.format(Locale.ROOT, KEY_FMT, index, property);
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, key));
        }
    }

    private static void requirePositive(int index, String property, int value) {
        if (value < MIN_POSITIVE) {
            String key = String.format(Locale.ROOT, KEY_FMT, index, property);
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public String getTransportKind() {
        return transportKind;
    }

    public void setTransportKind(final String transportKind) {
        this.transportKind = transportKind;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model;
    }

    /**
     * Returns the name of the property or environment variable holding the API key.
     *
     * @return credential reference
     */
    public String getCredentialRef() {
        return credentialRef;
    }

    public void setCredentialRef(final String credentialRef) {
        this.credentialRef = credentialRef;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(final String tier) {
        this.tier = tier;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public void setRequestsPerMinute(final int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    public int getTokensPerMinute() {
        return tokensPerMinute;
    }

    public void setTokensPerMinute(final int tokensPerMinute) {
        this.tokensPerMinute = tokensPerMinute;
    }
}
