package com.williamcallahan.setforge.service.retry;

import com.williamcallahan.setforge.domain.generation.FailureCategory;
import java.util.Objects;

/**
 * One failed attempt at a work item that is worth retrying.
 */
public class ItemAttemptException extends RuntimeException {

    private final FailureCategory category;

    public ItemAttemptException(FailureCategory category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    public FailureCategory getCategory() {
        return category;
    }
}
