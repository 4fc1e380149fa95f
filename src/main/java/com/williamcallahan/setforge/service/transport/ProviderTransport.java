package com.williamcallahan.setforge.service.transport;

import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.generation.TransportResponse;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;

/**
 * Sends a generation request over one wire protocol.
 *
 * Implementations return a {@link TransportResponse} for any answer the provider gave, including
 * unusable ones, and let transport and HTTP status failures escape as exceptions for
 * {@link ProviderFailureClassifier} to categorize.
 */
public interface ProviderTransport {

    /**
     * Protocol this adapter speaks.
     */
    TransportKind kind();

    /**
     * Performs one blocking call.
     *
     * @param provider target provider
     * @param payload request to send
     * @return normalized response
     */
    TransportResponse send(ProviderDescriptor provider, GenerationPayload payload);
}
