package com.williamcallahan.setforge.service.transport;

import com.openai.core.http.Headers;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.UnauthorizedException;
import com.williamcallahan.setforge.domain.generation.FailureCategory;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps exceptions raised by transport adapters onto {@link FailureCategory}.
 *
 * <p>HTTP statuses are read from OpenAI SDK and Spring {@code WebClient} exceptions alike: 429 is
 * throttling, 401/403 are fatal, 408/409/5xx are transient and any other 4xx means the provider
 * rejected the request shape. Exceptions that fit none of these are left unclassified so they
 * surface as genuine faults.</p>
 */
@Component
public class ProviderFailureClassifier {
    private static final Logger log = LoggerFactory.getLogger(ProviderFailureClassifier.class);

    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;
    private static final int MAX_CAUSE_DEPTH = 8;

    private final RetryAfterParser retryAfterParser;

    public ProviderFailureClassifier(RetryAfterParser retryAfterParser) {
        this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser");
    }

    /**
     * Categorizes a transport failure.
     *
     * @param failure exception thrown by a transport adapter
     * @return the category, or empty when the failure is not a recognized provider failure
     */
    public Optional<ProviderFailure> classify(Throwable failure) {
        if (failure == null) {
            return Optional.empty();
        }
        if (failure instanceof ProviderCredentialException) {
            return Optional.of(ProviderFailure.of(FailureCategory.FATAL, failure.getMessage()));
        }
        if (failure instanceof UnauthorizedException || failure instanceof PermissionDeniedException) {
            return Optional.of(ProviderFailure.of(FailureCategory.FATAL, describeStatus(failure)));
        }
        if (failure instanceof OpenAIServiceException serviceException) {
            Headers headers = serviceException.headers();
            return Optional.of(fromStatus(
                    serviceException.statusCode(),
                    () -> retryAfterParser.fromOpenAiHeaders(headers),
                    describeStatus(failure)));
        }
        if (failure instanceof WebClientResponseException responseException) {
            HttpHeaders headers = responseException.getHeaders();
            return Optional.of(fromStatus(
                    responseException.getStatusCode().value(),
                    () -> retryAfterParser.fromHttpHeaders(headers),
                    describeStatus(failure)));
        }
        if (failure instanceof WebClientRequestException || failure instanceof OpenAIIoException) {
            return Optional.of(ProviderFailure.of(FailureCategory.TRANSIENT, describe(failure)));
        }
        if (hasIoCause(failure)) {
            return Optional.of(ProviderFailure.of(FailureCategory.TRANSIENT, describe(failure)));
        }
        String normalizedMessage = normalizedMessageChain(failure);
        if (normalizedMessage.contains("resource exhausted") || normalizedMessage.contains("resource_exhausted")) {
            return Optional.of(ProviderFailure.of(FailureCategory.RATE_LIMITED, describe(failure)));
        }
        if (normalizedMessage.contains("timeout")
                || normalizedMessage.contains("timed out")
                || normalizedMessage.contains("connection reset")) {
            return Optional.of(ProviderFailure.of(FailureCategory.TRANSIENT, describe(failure)));
        }
        return Optional.empty();
    }

    private ProviderFailure fromStatus(int statusCode, Supplier<Optional<Duration>> retryHint, String detail) {
        if (statusCode == HTTP_TOO_MANY_REQUESTS) {
            return new ProviderFailure(FailureCategory.RATE_LIMITED, parseRetryHint(retryHint), detail);
        }
        if (statusCode == HTTP_UNAUTHORIZED || statusCode == HTTP_FORBIDDEN) {
            return ProviderFailure.of(FailureCategory.FATAL, detail);
        }
        if (statusCode == HTTP_REQUEST_TIMEOUT
                || statusCode == HTTP_CONFLICT
                || statusCode >= HTTP_INTERNAL_SERVER_ERROR) {
            return ProviderFailure.of(FailureCategory.TRANSIENT, detail);
        }
        if (statusCode >= HTTP_BAD_REQUEST) {
            return ProviderFailure.of(FailureCategory.MALFORMED_RESPONSE, detail);
        }
        return ProviderFailure.of(FailureCategory.TRANSIENT, detail);
    }

    private Duration parseRetryHint(Supplier<Optional<Duration>> retryHint) {
        try {
            return retryHint.get().orElse(null);
        } catch (IllegalArgumentException invalidHeader) {
            log.warn("[PROVIDER] Ignoring unparseable rate limit header: {}", invalidHeader.getMessage());
            return null;
        }
    }

    private static boolean hasIoCause(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof IOException
                    || current instanceof TimeoutException
                    || current instanceof OpenAIIoException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String normalizedMessageChain(Throwable failure) {
        StringBuilder messages = new StringBuilder();
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current.getMessage() != null) {
                messages.append(current.getMessage()).append(' ');
            }
            current = current.getCause();
        }
        return messages.toString().toLowerCase(Locale.ROOT);
    }

    private static String describeStatus(Throwable failure) {
        if (failure instanceof OpenAIServiceException serviceException) {
            return "HTTP " + serviceException.statusCode() + ": " + describe(failure);
        }
        if (failure instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value() + ": " + describe(failure);
        }
        return describe(failure);
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        String name = failure.getClass().getSimpleName();
        return message == null || message.isBlank() ? name : name + " - " + message;
    }
}
