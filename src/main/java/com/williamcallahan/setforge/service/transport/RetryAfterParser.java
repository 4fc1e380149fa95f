package com.williamcallahan.setforge.service.transport;

import com.openai.core.http.Headers;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;
import java.util.function.UnaryOperator;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Reads a provider's retry hint from throttling response headers.
 *
 * <p>{@code Retry-After} wins when present, as delta-seconds or an HTTP date. Otherwise the
 * shortest positive reset among the {@code x-ratelimit-reset*} headers is used; those carry
 * either epoch seconds or durations such as {@code 20s}, {@code 1m} or {@code 250ms}.</p>
 */
@Component
public final class RetryAfterParser {

    private static final List<String> RESET_DURATION_HEADERS =
            List.of("x-ratelimit-reset-requests", "x-ratelimit-reset-tokens", "x-ratelimit-reset");
    private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;

    private enum DurationUnit {
        MILLISECONDS("ms", Duration::ofMillis),
        DAYS("d", Duration::ofDays),
        HOURS("h", Duration::ofHours),
        MINUTES("m", Duration::ofMinutes),
        SECONDS("s", Duration::ofSeconds);

        private final String suffix;
        private final LongFunction<Duration> toDuration;

        DurationUnit(String suffix, LongFunction<Duration> toDuration) {
            this.suffix = suffix;
            this.toDuration = toDuration;
        }
    }

    private final Clock clock;

    public RetryAfterParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Retry hint from OpenAI SDK response headers.
     *
     * @throws IllegalArgumentException when a present header is unparseable
     */
    public Optional<Duration> fromOpenAiHeaders(Headers headers) {
        if (headers == null) {
            return Optional.empty();
        }
        return parse(name -> firstHeaderValue(headers, name));
    }

    /**
     * Retry hint from Spring response headers.
     *
     * @throws IllegalArgumentException when a present header is unparseable
     */
    public Optional<Duration> fromHttpHeaders(HttpHeaders headers) {
        if (headers == null) {
            return Optional.empty();
        }
        return parse(headers::getFirst);
    }

    Optional<Duration> parse(UnaryOperator<String> lookup) {
        String retryAfter = lookup.apply(HttpHeaders.RETRY_AFTER);
        if (retryAfter != null && !retryAfter.isBlank()) {
            return Optional.of(parseRetryAfter(retryAfter.trim()));
        }
        Duration shortest = null;
        for (String header : RESET_DURATION_HEADERS) {
            String value = lookup.apply(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            Duration candidate = parseResetValue(value.trim());
            if (!candidate.isZero() && (shortest == null || candidate.compareTo(shortest) < 0)) {
                shortest = candidate;
            }
        }
        return Optional.ofNullable(shortest);
    }

    /**
     * Parses a {@code Retry-After} value; dates in the past yield zero.
     */
    Duration parseRetryAfter(String value) {
        if (isDigits(value)) {
            return Duration.ofSeconds(Long.parseLong(value));
        }
        try {
            ZonedDateTime httpDate = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            return nonNegative(Duration.between(clock.instant(), httpDate.toInstant()));
        } catch (RuntimeException parseFailure) {
            throw new IllegalArgumentException("Invalid Retry-After header: " + value, parseFailure);
        }
    }

    private Duration parseResetValue(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (isDigits(normalized)) {
            long number = Long.parseLong(normalized);
            if (number >= EPOCH_SECONDS_THRESHOLD) {
                return nonNegative(Duration.between(clock.instant(), Instant.ofEpochSecond(number)));
            }
            return Duration.ofSeconds(number);
        }
        for (DurationUnit unit : DurationUnit.values()) {
            if (normalized.endsWith(unit.suffix)) {
                String number = normalized.substring(0, normalized.length() - unit.suffix.length()).trim();
                if (isDigits(number)) {
                    return unit.toDuration.apply(Long.parseLong(number));
                }
                break;
            }
        }
        throw new IllegalArgumentException("Invalid rate limit reset header: " + value);
    }

    private static String firstHeaderValue(Headers headers, String name) {
        for (String headerName : headers.names()) {
            if (headerName != null && headerName.equalsIgnoreCase(name)) {
                List<String> values = headers.values(headerName);
                return values == null || values.isEmpty() ? null : values.get(0);
            }
        }
        return null;
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static boolean isDigits(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        for (int index = 0; index < candidate.length(); index++) {
            if (!Character.isDigit(candidate.charAt(index))) {
                return false;
            }
        }
        return true;
    }
}
