package com.williamcallahan.setforge.domain.work;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of input to generate from.
 *
 * @param id stable identity used for checkpoint and dead-letter bookkeeping
 * @param payload opaque input text
 * @param sourcePath input file the payload was read from, or null for in-memory items
 */
public record WorkItem(String id, String payload, Path sourcePath) {
    public WorkItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public static WorkItem inMemory(String id, String payload) {
        return new WorkItem(id, payload, null);
    }

    public static WorkItem fromFile(String id, String payload, Path sourcePath) {
        Objects.requireNonNull(sourcePath, "sourcePath");
        return new WorkItem(id, payload, sourcePath);
    }

    /**
     * Returns the originating file when the item was read from disk.
     */
    public Optional<Path> source() {
        return Optional.ofNullable(sourcePath);
    }
}
