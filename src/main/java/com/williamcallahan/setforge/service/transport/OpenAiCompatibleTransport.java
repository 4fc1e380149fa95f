package com.williamcallahan.setforge.service.transport;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.generation.TransportResponse;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Chat completions over the OpenAI SDK, for OpenAI and OpenAI-compatible endpoints.
 *
 * <p>One SDK client is built per provider on first use and reused. SDK-level retries are
 * disabled; retrying belongs to the item retry layer so every attempt is counted against the
 * provider's rate limits.</p>
 */
@Component
public class OpenAiCompatibleTransport implements ProviderTransport {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleTransport.class);

    private final Function<ProviderDescriptor, OpenAIClient> clientFactory;
    private final Map<String, OpenAIClient> clients = new ConcurrentHashMap<>();

    @Autowired
    public OpenAiCompatibleTransport(
            ProviderCredentialResolver credentialResolver,
            @Value("${app.transport.request-timeout:60s}") Duration requestTimeout) {
        this(provider -> OpenAIOkHttpClient.builder()
                .apiKey(credentialResolver.resolve(provider))
                .baseUrl(provider.endpointBaseUrl())
                .timeout(requestTimeout)
                .maxRetries(0)
                .build());
    }

    OpenAiCompatibleTransport(Function<ProviderDescriptor, OpenAIClient> clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    @Override
    public TransportKind kind() {
        return TransportKind.OPENAI_COMPATIBLE;
    }

    @Override
    public TransportResponse send(ProviderDescriptor provider, GenerationPayload payload) {
        OpenAIClient client = clients.computeIfAbsent(provider.name(), name -> clientFactory.apply(provider));
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(provider.model())
                .addUserMessage(payload.prompt())
                .maxCompletionTokens(payload.maxTokens())
                .temperature(payload.temperature())
                .build();
        ChatCompletion completion = client.chat().completions().create(params);
        if (completion.choices().isEmpty()) {
            return TransportResponse.malformed("Completion contained no choices");
        }
        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElse("");
        if (content.isBlank()) {
            return TransportResponse.malformed("Completion content was empty");
        }
        return TransportResponse.success(content);
    }

    @PreDestroy
    void closeClients() {
        clients.forEach((name, client) -> {
            try {
                client.close();
            } catch (RuntimeException closeFailure) {
                log.warn("[PROVIDER] Failed to close client for {}: {}", name, closeFailure.getMessage());
            }
        });
        clients.clear();
    }
}
