package com.williamcallahan.setforge.service.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import com.williamcallahan.setforge.domain.generation.FailureCategory;
import com.williamcallahan.setforge.domain.work.WorkItem;
import com.williamcallahan.setforge.service.deadletter.DeadLetterQueue;
import com.williamcallahan.setforge.service.orchestration.ProviderFatalException;
import com.williamcallahan.setforge.support.Sleeper;
import com.williamcallahan.setforge.support.TestAppProperties;
import com.williamcallahan.setforge.support.VirtualTime;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies bounded retries, backoff timing, dead-lettering and the in-flight cap.
 */
class RetryingItemProcessorTest {

    private static final RetryPolicy POLICY = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));

    @TempDir
    Path tempDir;

    private VirtualTime time;
    private DeadLetterQueue deadLetterQueue;

    @BeforeEach
    void setUp() {
        time = VirtualTime.startingAt("2024-01-01T00:00:00Z");
        deadLetterQueue = new DeadLetterQueue(TestAppProperties.storedUnder(tempDir), time);
    }

    @Test
    void alwaysFailingItemIsAttemptedThreeTimesThenDeadLettered() throws InterruptedException {
        RetryingItemProcessor processor = new RetryingItemProcessor(deadLetterQueue, 4, POLICY, time);
        AtomicInteger attempts = new AtomicInteger();

        RetryResult<String> result = processor.process(WorkItem.inMemory("item-1", "payload"), item -> {
            attempts.incrementAndGet();
            throw new ItemAttemptException(FailureCategory.TRANSIENT, "HTTP 503");
        });

        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), time.sleeps());
        assertFalse(result.succeeded());
        assertEquals(3, result.attempts());
        DeadLetterEntry entry = result.deadLetter().orElseThrow();
        assertEquals("item-1", entry.itemId());
        assertTrue(entry.reason().startsWith("Failed after 3 attempts. Last error: ItemAttemptException: HTTP 503"));
        assertEquals(1, deadLetterQueue.list().size());
    }

    @Test
    void succeedsOnSecondAttemptAfterOneBackoff() throws InterruptedException {
        RetryingItemProcessor processor = new RetryingItemProcessor(deadLetterQueue, 4, POLICY, time);
        AtomicInteger attempts = new AtomicInteger();

        RetryResult<String> result = processor.process(WorkItem.inMemory("item-2", "payload"), item -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ItemAttemptException(FailureCategory.RATE_LIMITED, "throttled");
            }
            return "generated";
        });

        assertTrue(result.succeeded());
        assertEquals("generated", result.value().orElseThrow());
        assertEquals(2, result.attempts());
        assertEquals(List.of(Duration.ofSeconds(1)), time.sleeps());
        assertFalse(deadLetterQueue.contains("item-2"));
    }

    @Test
    void fatalProviderFailureIsNeverRetried() {
        RetryingItemProcessor processor = new RetryingItemProcessor(deadLetterQueue, 4, POLICY, time);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(
                ProviderFatalException.class,
                () -> processor.process(WorkItem.inMemory("item-3", "payload"), item -> {
                    attempts.incrementAndGet();
                    throw new ProviderFatalException("openai", "invalid API key", null);
                }));

        assertEquals(1, attempts.get());
        assertTrue(time.sleeps().isEmpty());
        assertFalse(deadLetterQueue.contains("item-3"));
    }

    @Test
    void backoffIsCappedAtMaximum() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(16), policy.backoffAfter(4));
        assertEquals(Duration.ofSeconds(30), policy.backoffAfter(5));
        assertEquals(Duration.ofSeconds(30), policy.backoffAfter(62));
    }

    @Test
    void inFlightItemsNeverExceedLimit() throws Exception {
        RetryingItemProcessor processor = new RetryingItemProcessor(deadLetterQueue, 2, POLICY, Sleeper.SYSTEM);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(6);

        try {
            List<Future<RetryResult<String>>> futures = new ArrayList<>();
            for (int index = 0; index < 12; index++) {
                WorkItem item = WorkItem.inMemory("item-" + index, "payload");
                futures.add(workers.submit(() -> processor.process(item, work -> {
                    int now = active.incrementAndGet();
                    maxActive.accumulateAndGet(now, Math::max);
                    Thread.sleep(20);
                    active.decrementAndGet();
                    return work.id();
                })));
            }
            for (Future<RetryResult<String>> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS).succeeded());
            }
        } finally {
            workers.shutdownNow();
        }

        assertTrue(maxActive.get() <= 2, "max in flight was " + maxActive.get());
    }
}
