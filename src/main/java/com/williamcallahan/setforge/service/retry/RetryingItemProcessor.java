package com.williamcallahan.setforge.service.retry;

import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import com.williamcallahan.setforge.domain.work.WorkItem;
import com.williamcallahan.setforge.service.deadletter.DeadLetterQueue;
import com.williamcallahan.setforge.service.orchestration.ProviderFatalException;
import com.williamcallahan.setforge.support.Sleeper;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work items with bounded retries, exponential backoff and a cap on items in flight.
 *
 * <p>Each item takes a permit before its first attempt and returns it when it reaches a terminal
 * state, so at most {@code maxInFlight} items are being worked on regardless of how many
 * providers exist. When the last attempt fails the item goes to the dead-letter queue. A
 * {@link ProviderFatalException} is never retried.</p>
 */
public class RetryingItemProcessor {
    private static final Logger log = LoggerFactory.getLogger(RetryingItemProcessor.class);

    private final DeadLetterQueue deadLetterQueue;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Semaphore inFlight;

    public RetryingItemProcessor(DeadLetterQueue deadLetterQueue, int maxInFlight, RetryPolicy policy, Sleeper sleeper) {
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1");
        }
        this.inFlight = new Semaphore(maxInFlight);
    }

    /**
     * Processes {@code item} until it succeeds or exhausts its attempts.
     *
     * @return the successful value, or the dead-letter entry the item was moved to
     * @throws ProviderFatalException when an attempt hits a fatal provider failure
     * @throws InterruptedException if interrupted while waiting for a permit or backing off
     */
    public <T> RetryResult<T> process(WorkItem item, ItemWork<T> work) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(work, "work");
        inFlight.acquire();
        try {
            return processWithRetries(item, work);
        } finally {
            inFlight.release();
        }
    }

    private <T> RetryResult<T> processWithRetries(WorkItem item, ItemWork<T> work) throws InterruptedException {
        int maxAttempts = policy.maxAttempts();
        Exception lastFailure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                T value = work.attempt(item);
                if (attempt > 0) {
                    log.info("[RETRY] {} succeeded on attempt {}/{}", item.id(), attempt + 1, maxAttempts);
                }
                return RetryResult.succeeded(value, attempt + 1);
            } catch (ProviderFatalException fatal) {
                log.error("[RETRY] {} hit a fatal provider failure; not retrying", item.id());
                throw fatal;
            } catch (InterruptedException interrupted) {
                throw interrupted;
            } catch (Exception failure) {
                lastFailure = failure;
                if (attempt + 1 < maxAttempts) {
                    Duration backoff = policy.backoffAfter(attempt);
                    log.warn(
                            "[RETRY] {} failed on attempt {}/{}, retrying in {}ms: {}",
                            item.id(),
                            attempt + 1,
                            maxAttempts,
                            backoff.toMillis(),
                            failure.getMessage());
                    sleeper.sleep(backoff);
                } else {
                    log.error("[RETRY] {} failed after {} attempts: {}", item.id(), maxAttempts, failure.getMessage());
                }
            }
        }
        DeadLetterEntry entry = deadLetterQueue.add(item, describe(lastFailure, maxAttempts));
        return RetryResult.deadLettered(entry, maxAttempts);
    }

    private static String describe(Exception failure, int attempts) {
        String message = failure == null ? null : failure.getMessage();
        String cause = failure == null
                ? "unknown"
                : failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
        return "Failed after " + attempts + " attempts. Last error: " + cause;
    }
}
