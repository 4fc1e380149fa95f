package com.williamcallahan.setforge.service.retry;

import com.williamcallahan.setforge.domain.work.WorkItem;

/**
 * The unit of work retried for one item.
 *
 * @param <T> result of a successful attempt
 */
@FunctionalInterface
public interface ItemWork<T> {

    /**
     * Performs one attempt. Any exception other than {@code ProviderFatalException} or
     * {@link InterruptedException} counts as a failed, retryable attempt.
     */
    T attempt(WorkItem item) throws Exception;
}
