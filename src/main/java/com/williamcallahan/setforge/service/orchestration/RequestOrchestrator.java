package com.williamcallahan.setforge.service.orchestration;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.generation.DispatchOutcome;
import com.williamcallahan.setforge.domain.generation.FailureCategory;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.generation.TransportResponse;
import com.williamcallahan.setforge.service.provider.ProviderCooldownRegistry;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import com.williamcallahan.setforge.service.provider.ProviderRegistry;
import com.williamcallahan.setforge.service.ratelimit.TokenEstimator;
import com.williamcallahan.setforge.service.transport.ProviderFailure;
import com.williamcallahan.setforge.service.transport.ProviderFailureClassifier;
import com.williamcallahan.setforge.service.transport.ProviderTransport;
import com.williamcallahan.setforge.service.transport.ProviderTransportRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dispatches one generation request through a selected provider.
 *
 * <p>Selection (which reserves rate-limit capacity), the transport call and outcome classification
 * happen here. A throttled provider is put on cooldown for its retry hint, or the default cooldown
 * when it sent none, so the next selection rotates to another provider. Every attempt is timed under
 * {@code setforge.provider.requests}, tagged by provider and outcome.</p>
 *
 * <p>A missing provider list or a provider whose transport has no adapter is reported as
 * {@link DispatchOutcome.Fatal}, not retried per item.</p>
 */
@Service
public class RequestOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RequestOrchestrator.class);

    static final String REQUEST_TIMER = "setforge.provider.requests";
    static final String NO_PROVIDER = "none";

    private final ProviderRegistry providerRegistry;
    private final ProviderTransportRegistry transportRegistry;
    private final ProviderFailureClassifier failureClassifier;
    private final ProviderCooldownRegistry cooldownRegistry;
    private final TokenEstimator tokenEstimator;
    private final MeterRegistry meterRegistry;
    private final Duration defaultCooldown;

    public RequestOrchestrator(
            ProviderRegistry providerRegistry,
            ProviderTransportRegistry transportRegistry,
            ProviderFailureClassifier failureClassifier,
            ProviderCooldownRegistry cooldownRegistry,
            TokenEstimator tokenEstimator,
            MeterRegistry meterRegistry,
            AppProperties appProperties) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.transportRegistry = Objects.requireNonNull(transportRegistry, "transportRegistry");
        this.failureClassifier = Objects.requireNonNull(failureClassifier, "failureClassifier");
        this.cooldownRegistry = Objects.requireNonNull(cooldownRegistry, "cooldownRegistry");
        this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.defaultCooldown = appProperties.getSelection().getDefaultCooldown();
    }

    /**
     * Sends {@code payload} to one provider and classifies what happened.
     *
     * @return the categorized outcome of this single attempt
     * @throws InterruptedException if interrupted while waiting for a provider or its rate limits
     * @throws RuntimeException when the transport fails in a way no category covers
     */
    public DispatchOutcome dispatch(GenerationPayload payload) throws InterruptedException {
        Objects.requireNonNull(payload, "payload");
        long estimatedTokens = tokenEstimator.estimate(payload);
        if (providerRegistry.size() == 0) {
            log.error("[PROVIDER] No providers configured; cannot dispatch");
            return new DispatchOutcome.Fatal(NO_PROVIDER, "No providers configured", null);
        }
        ProviderDescriptor provider = providerRegistry.select(estimatedTokens);
        ProviderTransport transport;
        try {
            transport = transportRegistry.forKind(provider.transportKind());
        } catch (IllegalStateException missingTransport) {
            log.error("[PROVIDER] {} cannot be called: {}", provider.name(), missingTransport.getMessage());
            return new DispatchOutcome.Fatal(provider.name(), missingTransport.getMessage(), missingTransport);
        }

        log.debug("[PROVIDER] Dispatching to {} (model={}, ~{} tokens)", provider.name(), provider.model(), estimatedTokens);
        long startNanos = System.nanoTime();
        DispatchOutcome outcome;
        try {
            TransportResponse response = transport.send(provider, payload);
            outcome = fromResponse(provider, response, elapsedSince(startNanos));
        } catch (RuntimeException failure) {
            Duration latency = elapsedSince(startNanos);
            Optional<ProviderFailure> classified = failureClassifier.classify(failure);
            if (classified.isEmpty()) {
                recordAttempt(provider, "unexpected", latency);
                log.error("[PROVIDER] Unexpected failure from {} after {}ms", provider.name(), latency.toMillis(), failure);
                throw failure;
            }
            outcome = fromFailure(provider, classified.get(), failure);
            recordAttempt(provider, outcome.outcomeTag(), latency);
            return outcome;
        }
        recordAttempt(provider, outcome.outcomeTag(), elapsedSince(startNanos));
        return outcome;
    }

    private DispatchOutcome fromResponse(ProviderDescriptor provider, TransportResponse response, Duration latency) {
        if (response.success() && !response.content().isBlank()) {
            log.info("[PROVIDER] {} succeeded in {}ms", provider.name(), latency.toMillis());
            return new DispatchOutcome.Success(response.content(), provider.name(), provider.model(), latency);
        }
        String detail = response.content().isBlank() ? "Empty response content" : response.content();
        log.warn("[PROVIDER] {} returned an unusable response after {}ms: {}", provider.name(), latency.toMillis(), detail);
        return new DispatchOutcome.SoftFailure(provider.name(), detail);
    }

    private DispatchOutcome fromFailure(ProviderDescriptor provider, ProviderFailure failure, RuntimeException cause) {
        FailureCategory category = failure.category();
        if (category == FailureCategory.RATE_LIMITED) {
            Duration cooldown = failure.retryHint().orElse(defaultCooldown);
            cooldownRegistry.coolDown(provider.name(), cooldown);
            log.warn("[PROVIDER] {} rate limited: {}", provider.name(), failure.detail());
            return new DispatchOutcome.Retryable(provider.name(), category, failure.detail());
        }
        if (category == FailureCategory.TRANSIENT) {
            log.warn("[PROVIDER] {} transient failure: {}", provider.name(), failure.detail());
            return new DispatchOutcome.Retryable(provider.name(), category, failure.detail());
        }
        if (category == FailureCategory.MALFORMED_RESPONSE) {
            log.warn("[PROVIDER] {} rejected the request: {}", provider.name(), failure.detail());
            return new DispatchOutcome.SoftFailure(provider.name(), failure.detail());
        }
        log.error("[PROVIDER] {} fatal failure: {}", provider.name(), failure.detail());
        return new DispatchOutcome.Fatal(provider.name(), failure.detail(), cause);
    }

    private void recordAttempt(ProviderDescriptor provider, String outcomeTag, Duration latency) {
        Timer.builder(REQUEST_TIMER)
                .description("Provider call latency per attempt")
                .tag("provider", provider.name())
                .tag("outcome", outcomeTag)
                .register(meterRegistry)
                .record(latency);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
