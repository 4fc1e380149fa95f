package com.williamcallahan.setforge.domain.deadletter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A work item isolated after exhausting its retries.
 *
 * @param itemId identity of the failed item
 * @param payloadFile file holding the item's payload inside the dead-letter directory
 * @param reasonFile sibling file describing the failure
 * @param reason failure description
 * @param failedAt when the item was dead-lettered
 */
public record DeadLetterEntry(String itemId, Path payloadFile, Path reasonFile, String reason, Instant failedAt) {
    public DeadLetterEntry {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(payloadFile, "payloadFile");
        Objects.requireNonNull(reasonFile, "reasonFile");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(failedAt, "failedAt");
    }
}
