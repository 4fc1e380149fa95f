package com.williamcallahan.setforge.service.provider;

import com.williamcallahan.setforge.domain.provider.ProviderTier;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.ratelimit.ProviderAdmissionGate;
import java.util.Objects;

/**
 * Immutable description of one configured provider and its admission gate.
 *
 * @param name unique provider name
 * @param transportKind protocol used to reach the provider
 * @param model model identifier sent with each request
 * @param credentialRef property or environment variable holding the API key
 * @param baseUrl configured endpoint, or null to use the transport default
 * @param tier priority class
 * @param admissionGate request and token limits
 */
public record ProviderDescriptor(
        String name,
        TransportKind transportKind,
        String model,
        String credentialRef,
        String baseUrl,
        ProviderTier tier,
        ProviderAdmissionGate admissionGate) {
    public ProviderDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transportKind, "transportKind");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(credentialRef, "credentialRef");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(admissionGate, "admissionGate");
    }

    /**
     * Returns the endpoint to call, without a trailing slash.
     */
    public String endpointBaseUrl() {
        String url = baseUrl == null || baseUrl.isBlank() ? transportKind.defaultBaseUrl() : baseUrl.trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
