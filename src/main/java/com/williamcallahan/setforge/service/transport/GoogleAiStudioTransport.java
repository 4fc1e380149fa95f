package com.williamcallahan.setforge.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.generation.TransportResponse;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Calls the Google AI Studio {@code generateContent} endpoint with {@link WebClient}.
 *
 * A response without candidates, or whose first candidate carries no text, is reported as a
 * malformed response rather than an exception.
 */
@Component
public class GoogleAiStudioTransport implements ProviderTransport {

    private final WebClient webClient;
    private final ProviderCredentialResolver credentialResolver;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public GoogleAiStudioTransport(
            WebClient.Builder webClientBuilder,
            ProviderCredentialResolver credentialResolver,
            ObjectMapper objectMapper,
            @Value("${app.transport.request-timeout:60s}") Duration requestTimeout) {
        this.webClient = webClientBuilder.build();
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public TransportKind kind() {
        return TransportKind.GOOGLE_AI_STUDIO;
    }

    @Override
    public TransportResponse send(ProviderDescriptor provider, GenerationPayload payload) {
        String apiKey = credentialResolver.resolve(provider);
        String endpoint = provider.endpointBaseUrl() + "/models/" + provider.model() + ":generateContent?key={key}";
        Map<String, Object> requestBody = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", payload.prompt())))),
                "generationConfig", Map.of(
                        "maxOutputTokens", payload.maxTokens(),
                        "temperature", payload.temperature()));

        String responseBody = webClient.post()
                .uri(endpoint, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block();
        return parseResponse(responseBody);
    }

    TransportResponse parseResponse(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return TransportResponse.malformed("Empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException parseFailure) {
            return TransportResponse.malformed("Unparseable response body: " + parseFailure.getOriginalMessage());
        }
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return TransportResponse.malformed("Response contained no candidates");
        }
        String text = candidates.get(0).path("content").path("parts").path(0).path("text").asText("");
        if (text.isBlank()) {
            return TransportResponse.malformed("First candidate contained no text");
        }
        return TransportResponse.success(text);
    }
}
