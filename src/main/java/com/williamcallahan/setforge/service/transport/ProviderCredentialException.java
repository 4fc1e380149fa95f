package com.williamcallahan.setforge.service.transport;

/**
 * Thrown when a provider's credential reference resolves to nothing.
 */
public class ProviderCredentialException extends RuntimeException {

    private final String providerName;

    public ProviderCredentialException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
