package com.williamcallahan.setforge.service.orchestration;

import static com.williamcallahan.setforge.service.provider.ProviderTestFixtures.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openai.core.http.Headers;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnexpectedStatusCodeException;
import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.generation.DispatchOutcome;
import com.williamcallahan.setforge.domain.generation.FailureCategory;
import com.williamcallahan.setforge.domain.generation.GenerationPayload;
import com.williamcallahan.setforge.domain.generation.TransportResponse;
import com.williamcallahan.setforge.domain.provider.ProviderTier;
import com.williamcallahan.setforge.domain.provider.TransportKind;
import com.williamcallahan.setforge.service.provider.ProviderCooldownRegistry;
import com.williamcallahan.setforge.service.provider.ProviderDescriptor;
import com.williamcallahan.setforge.service.provider.ProviderRegistry;
import com.williamcallahan.setforge.service.ratelimit.TokenEstimator;
import com.williamcallahan.setforge.service.transport.ProviderCredentialException;
import com.williamcallahan.setforge.service.transport.ProviderFailureClassifier;
import com.williamcallahan.setforge.service.transport.ProviderTransport;
import com.williamcallahan.setforge.service.transport.ProviderTransportRegistry;
import com.williamcallahan.setforge.service.transport.RetryAfterParser;
import com.williamcallahan.setforge.support.VirtualTime;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies single-attempt dispatch, outcome classification and provider cooldowns.
 */
class RequestOrchestratorTest {

    private static final GenerationPayload PAYLOAD = new GenerationPayload("Describe a bounded queue.", 100, 0.1);

    private VirtualTime time;
    private ProviderCooldownRegistry cooldowns;
    private ScriptedTransport transport;
    private SimpleMeterRegistry meterRegistry;
    private RequestOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        cooldowns = new ProviderCooldownRegistry(time);
        transport = new ScriptedTransport();
        meterRegistry = new SimpleMeterRegistry();
        List<ProviderDescriptor> providers =
                List.of(provider("alpha", ProviderTier.PAID, 100, time), provider("beta", ProviderTier.FREE, 100, time));
        orchestrator = newOrchestrator(providers, transport);
    }

    @Test
    void successfulCallReturnsContentAndRecordsTimer() throws InterruptedException {
        transport.respond(() -> TransportResponse.success("A queue with a capacity."));

        DispatchOutcome outcome = orchestrator.dispatch(PAYLOAD);

        DispatchOutcome.Success success = assertInstanceOf(DispatchOutcome.Success.class, outcome);
        assertEquals("A queue with a capacity.", success.content());
        assertEquals("alpha", success.providerName());
        assertEquals("alpha-model", success.model());
        assertEquals(1, timer("alpha", "success").count());
        assertEquals(99, calledProvider("alpha").admissionGate().requestLimiter().availablePermits());
    }

    @Test
    void rateLimitedProviderCoolsDownForRetryHintAndSelectionRotates() throws InterruptedException {
        Headers headers = Headers.builder().put("Retry-After", "45").build();
        transport.respond(() -> {
            throw RateLimitException.builder().headers(headers).build();
        });
        transport.respond(() -> TransportResponse.success("from beta"));
        transport.respond(() -> TransportResponse.success("beta again"));

        DispatchOutcome throttled = orchestrator.dispatch(PAYLOAD);
        DispatchOutcome next = orchestrator.dispatch(PAYLOAD);
        DispatchOutcome third = orchestrator.dispatch(PAYLOAD);

        DispatchOutcome.Retryable retryable = assertInstanceOf(DispatchOutcome.Retryable.class, throttled);
        assertEquals(FailureCategory.RATE_LIMITED, retryable.category());
        assertEquals(Duration.ofSeconds(45), cooldowns.remaining("alpha"));
        assertEquals("beta", next.providerName());
        assertEquals("beta", third.providerName());
        assertEquals(List.of("alpha", "beta", "beta"), transport.calledProviders());
        assertEquals(1, timer("alpha", "rate_limited").count());
    }

    @Test
    void rateLimitWithoutHintUsesDefaultCooldown() throws InterruptedException {
        transport.respond(() -> {
            throw UnexpectedStatusCodeException.builder()
                    .statusCode(429)
                    .headers(Headers.builder().build())
                    .build();
        });

        orchestrator.dispatch(PAYLOAD);

        assertEquals(Duration.ofSeconds(60), cooldowns.remaining("alpha"));
    }

    @Test
    void transientFailureDoesNotCoolDownProvider() throws InterruptedException {
        transport.respond(() -> {
            throw UnexpectedStatusCodeException.builder()
                    .statusCode(502)
                    .headers(Headers.builder().build())
                    .build();
        });

        DispatchOutcome outcome = orchestrator.dispatch(PAYLOAD);

        assertEquals(FailureCategory.TRANSIENT, outcome.failureCategory().orElseThrow());
        assertFalse(cooldowns.isCoolingDown("alpha"));
        assertEquals(1, timer("alpha", "transient").count());
    }

    @Test
    void unusableResponseIsSoftFailure() throws InterruptedException {
        transport.respond(() -> TransportResponse.malformed("Completion contained no choices"));

        DispatchOutcome outcome = orchestrator.dispatch(PAYLOAD);

        DispatchOutcome.SoftFailure softFailure = assertInstanceOf(DispatchOutcome.SoftFailure.class, outcome);
        assertEquals("Completion contained no choices", softFailure.detail());
        assertFalse(outcome.succeeded());
        assertEquals(1, timer("alpha", "malformed").count());
    }

    @Test
    void missingCredentialIsFatal() throws InterruptedException {
        ProviderCredentialException missing = new ProviderCredentialException("alpha", "ALPHA_KEY is not set");
        transport.respond(() -> {
            throw missing;
        });

        DispatchOutcome outcome = orchestrator.dispatch(PAYLOAD);

        DispatchOutcome.Fatal fatal = assertInstanceOf(DispatchOutcome.Fatal.class, outcome);
        assertSame(missing, fatal.cause());
        assertEquals(1, timer("alpha", "fatal").count());
    }

    @Test
    void unclassifiedFailureIsRethrown() {
        IllegalArgumentException bug = new IllegalArgumentException("bad request builder");
        transport.respond(() -> {
            throw bug;
        });

        IllegalArgumentException thrown =
                assertThrows(IllegalArgumentException.class, () -> orchestrator.dispatch(PAYLOAD));

        assertSame(bug, thrown);
        assertEquals(1, timer("alpha", "unexpected").count());
    }

    @Test
    void waitsForAProviderWhenAllAreCoolingDown() throws InterruptedException {
        cooldowns.coolDown("alpha", Duration.ofSeconds(8));
        cooldowns.coolDown("beta", Duration.ofSeconds(8));
        transport.respond(() -> TransportResponse.success("eventually"));

        DispatchOutcome outcome = orchestrator.dispatch(PAYLOAD);

        assertTrue(outcome.succeeded());
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5)), time.sleeps());
    }

    @Test
    void noConfiguredProvidersIsFatal() throws InterruptedException {
        RequestOrchestrator unconfigured = newOrchestrator(List.of(), transport);

        DispatchOutcome outcome = unconfigured.dispatch(PAYLOAD);

        DispatchOutcome.Fatal fatal = assertInstanceOf(DispatchOutcome.Fatal.class, outcome);
        assertEquals("No providers configured", fatal.detail());
        assertTrue(transport.calledProviders().isEmpty());
    }

    @Test
    void providerWithoutTransportAdapterIsFatal() throws InterruptedException {
        RequestOrchestrator mismatched = newOrchestrator(
                List.of(provider("gemini", TransportKind.GOOGLE_AI_STUDIO, ProviderTier.FREE, 100, time)), transport);

        DispatchOutcome outcome = mismatched.dispatch(PAYLOAD);

        DispatchOutcome.Fatal fatal = assertInstanceOf(DispatchOutcome.Fatal.class, outcome);
        assertEquals("gemini", fatal.providerName());
        assertTrue(transport.calledProviders().isEmpty());
    }

    @Test
    void providerThrottledWhileAnotherCallWaitsIsNeverCalledDuringCooldown() throws Exception {
        CountDownLatch alphaInFlight = new CountDownLatch(1);
        CountDownLatch releaseAlpha = new CountDownLatch(1);
        List<String> callsDuringCooldown = new CopyOnWriteArrayList<>();
        ProviderTransport throttlingTransport = new ProviderTransport() {
            @Override
            public TransportKind kind() {
                return TransportKind.OPENAI_COMPATIBLE;
            }

            @Override
            public TransportResponse send(ProviderDescriptor descriptor, GenerationPayload payload) {
                if (cooldowns.isCoolingDown(descriptor.name())) {
                    callsDuringCooldown.add(descriptor.name());
                }
                if (!descriptor.name().equals("alpha")) {
                    return TransportResponse.success("from " + descriptor.name());
                }
                alphaInFlight.countDown();
                try {
                    releaseAlpha.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                }
                throw RateLimitException.builder()
                        .headers(Headers.builder().put("Retry-After", "300").build())
                        .build();
            }
        };
        RequestOrchestrator contended = newOrchestrator(
                List.of(provider("alpha", ProviderTier.PAID, 1, time), provider("beta", ProviderTier.FREE, 100, time)),
                throttlingTransport);

        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Future<DispatchOutcome> first = worker.submit(() -> contended.dispatch(PAYLOAD));
            assertTrue(alphaInFlight.await(5, TimeUnit.SECONDS));

            DispatchOutcome concurrent = contended.dispatch(PAYLOAD);
            releaseAlpha.countDown();
            DispatchOutcome throttled = first.get(5, TimeUnit.SECONDS);
            time.advance(Duration.ofSeconds(61));
            DispatchOutcome afterWindow = contended.dispatch(PAYLOAD);

            assertEquals("beta", concurrent.providerName());
            assertEquals(FailureCategory.RATE_LIMITED, throttled.failureCategory().orElseThrow());
            assertEquals("beta", afterWindow.providerName());
            assertTrue(callsDuringCooldown.isEmpty());
            assertTrue(time.sleeps().isEmpty());
        } finally {
            releaseAlpha.countDown();
            worker.shutdownNow();
        }
    }

    private RequestOrchestrator newOrchestrator(List<ProviderDescriptor> providers, ProviderTransport adapter) {
        return new RequestOrchestrator(
                new ProviderRegistry(providers, cooldowns, Duration.ofSeconds(5), time),
                new ProviderTransportRegistry(List.of(adapter)),
                new ProviderFailureClassifier(new RetryAfterParser(time)),
                cooldowns,
                new TokenEstimator(),
                meterRegistry,
                new AppProperties());
    }

    private ProviderDescriptor calledProvider(String name) {
        return transport.lastProviders.stream()
                .filter(descriptor -> descriptor.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private Timer timer(String providerName, String outcome) {
        Timer timer = meterRegistry
                .find(RequestOrchestrator.REQUEST_TIMER)
                .tag("provider", providerName)
                .tag("outcome", outcome)
                .timer();
        assertNotNull(timer, "timer for " + providerName + "/" + outcome);
        return timer;
    }

    private static final class ScriptedTransport implements ProviderTransport {
        private final Deque<Supplier<TransportResponse>> script = new ArrayDeque<>();
        private final List<String> calls = new ArrayList<>();
        private final List<ProviderDescriptor> lastProviders = new ArrayList<>();

        void respond(Supplier<TransportResponse> response) {
            script.add(response);
        }

        List<String> calledProviders() {
            return List.copyOf(calls);
        }

        @Override
        public TransportKind kind() {
            return TransportKind.OPENAI_COMPATIBLE;
        }

        @Override
        public TransportResponse send(ProviderDescriptor provider, GenerationPayload payload) {
            calls.add(provider.name());
            lastProviders.add(provider);
            Supplier<TransportResponse> next = script.poll();
            if (next == null) {
                throw new IllegalStateException("No scripted response left");
            }
            return next.get();
        }
    }
}
