package com.williamcallahan.setforge.service.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.openai.core.http.Headers;
import com.williamcallahan.setforge.support.VirtualTime;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

/**
 * Verifies retry hints read from throttling headers.
 */
class RetryAfterParserTest {

    private final RetryAfterParser parser = new RetryAfterParser(VirtualTime.startingAt("2024-01-01T00:00:00Z"));

    @Test
    void retryAfterSecondsWinsOverResetHeaders() {
        Headers headers = Headers.builder()
                .put("Retry-After", "12")
                .put("x-ratelimit-reset-requests", "2s")
                .build();

        assertEquals(Optional.of(Duration.ofSeconds(12)), parser.fromOpenAiHeaders(headers));
    }

    @Test
    void retryAfterHttpDateIsMeasuredFromNow() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "Mon, 01 Jan 2024 00:00:30 GMT");

        assertEquals(Optional.of(Duration.ofSeconds(30)), parser.fromHttpHeaders(headers));
    }

    @Test
    void shortestResetHeaderIsUsedWhenRetryAfterIsMissing() {
        Headers headers = Headers.builder()
                .put("x-ratelimit-reset-requests", "1m")
                .put("x-ratelimit-reset-tokens", "250ms")
                .build();

        assertEquals(Optional.of(Duration.ofMillis(250)), parser.fromOpenAiHeaders(headers));
    }

    @Test
    void epochSecondsResetIsConvertedToRemainingTime() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-ratelimit-reset", "1704067245");

        assertEquals(Optional.of(Duration.ofSeconds(45)), parser.fromHttpHeaders(headers));
    }

    @Test
    void missingHeadersYieldNoHint() {
        assertTrue(parser.fromOpenAiHeaders(Headers.builder().put("x-request-id", "abc").build()).isEmpty());
        assertTrue(parser.fromHttpHeaders(new HttpHeaders()).isEmpty());
        assertTrue(parser.fromHttpHeaders(null).isEmpty());
    }

    @Test
    void malformedHeaderIsRejected() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-ratelimit-reset-requests", "soon");

        assertThrows(IllegalArgumentException.class, () -> parser.fromHttpHeaders(headers));
    }
}
