package com.williamcallahan.setforge.service.transport;

import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import java.util.Objects;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Resolves a provider's API key from the Spring {@link Environment}.
 *
 * The credential reference is looked up as a property name, so both environment variables and
 * application properties work.
 */
@Component
public class ProviderCredentialResolver {

    private final Environment environment;

    public ProviderCredentialResolver(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Returns the trimmed API key for {@code provider}.
     *
     * @throws ProviderCredentialException when the reference is unset or blank
     */
    public String resolve(ProviderDescriptor provider) {
        String credential = environment.getProperty(provider.credentialRef());
        if (credential == null || credential.isBlank()) {
            throw new ProviderCredentialException(
                    provider.name(),
                    "Credential '" + provider.credentialRef() + "' for provider " + provider.name() + " is not set");
        }
        return credential.trim();
    }
}
