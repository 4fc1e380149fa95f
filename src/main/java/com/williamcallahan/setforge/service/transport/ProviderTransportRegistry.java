package com.williamcallahan.setforge.service.transport;

import com.williamcallahan.setforge.domain.provider.TransportKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Looks up the transport adapter for a {@link TransportKind}.
 */
@Component
public class ProviderTransportRegistry {

    private final Map<TransportKind, ProviderTransport> transports = new EnumMap<>(TransportKind.class);

    public ProviderTransportRegistry(List<ProviderTransport> adapters) {
        for (ProviderTransport adapter : adapters) {
            ProviderTransport previous = transports.putIfAbsent(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Multiple transports registered for " + adapter.kind());
            }
        }
    }

    /**
     * Returns the adapter for {@code kind}.
     *
     * @throws IllegalStateException when no adapter speaks that protocol
     */
    public ProviderTransport forKind(TransportKind kind) {
        ProviderTransport transport = transports.get(kind);
        if (transport == null) {
            throw new IllegalStateException("No transport registered for " + kind);
        }
        return transport;
    }
}
