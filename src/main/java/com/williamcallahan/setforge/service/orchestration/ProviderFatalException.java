package com.williamcallahan.setforge.service.orchestration;

/**
 * A provider failure no retry can fix, such as rejected or missing credentials.
 *
 * Aborts the run and propagates to the top-level runner.
 */
public class ProviderFatalException extends RuntimeException {

    private final String providerName;

    public ProviderFatalException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
