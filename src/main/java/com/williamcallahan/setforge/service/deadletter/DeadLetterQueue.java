package com.williamcallahan.setforge.service.deadletter;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.deadletter.DeadLetterEntry;
import com.williamcallahan.setforge.domain.work.WorkItem;
import com.williamcallahan.setforge.support.SafeFileNames;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Durable holding area for work items that exhausted their retries.
 *
 * <p>Each item leaves two files named after its identity: the payload (the moved input file, or
 * the in-memory payload written out) and a {@code .reason.txt} file recording the item id, payload
 * file, failure time and reason. Moving input files out of the input directory keeps the next run
 * from picking them up again. Entries are only removed by {@link #purgeOlderThan(Duration)}.</p>
 */
@Service
public class DeadLetterQueue {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    static final String REASON_SUFFIX = ".reason.txt";
    static final String PAYLOAD_SUFFIX = ".payload.txt";
    private static final String HEADER = "Item failed processing.";
    private static final String ITEM_KEY = "Item: ";
    private static final String PAYLOAD_KEY = "Payload: ";
    private static final String FAILED_AT_KEY = "Failed at: ";
    private static final String REASON_KEY = "Reason: ";

    private final Path directory;
    private final Clock clock;

    public DeadLetterQueue(AppProperties appProperties, Clock clock) {
        this.directory = Path.of(appProperties.getDeadLetter().getDir());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Isolates {@code item} with its failure reason.
     *
     * @return the stored entry
     * @throws UncheckedIOException when the payload or reason file cannot be written
     */
    public DeadLetterEntry add(WorkItem item, String reason) {
        Objects.requireNonNull(item, "item");
        String failureReason = reason == null || reason.isBlank() ? "unspecified" : reason;
        String stem = SafeFileNames.toSafeStem(item.id());
        Instant failedAt = clock.instant();
        try {
            Files.createDirectories(directory);
            Path payloadFile = storePayload(item, stem);
            Path reasonFile = directory.resolve(stem + REASON_SUFFIX);
            String reasonText = HEADER + "\n"
                    + ITEM_KEY + item.id() + "\n"
                    + PAYLOAD_KEY + payloadFile.getFileName() + "\n"
                    + FAILED_AT_KEY + failedAt + "\n"
                    + REASON_KEY + failureReason + "\n";
            Path tempFile = directory.resolve(stem + REASON_SUFFIX + ".tmp");
            Files.writeString(tempFile, reasonText, StandardCharsets.UTF_8);
            Files.move(tempFile, reasonFile, StandardCopyOption.REPLACE_EXISTING);
            log.warn("[DLQ] Moved {} to the dead-letter queue: {}", item.id(), failureReason);
            return new DeadLetterEntry(item.id(), payloadFile, reasonFile, failureReason, failedAt);
        } catch (IOException writeFailure) {
            log.error("[DLQ] Failed to dead-letter {} under {}", item.id(), directory, writeFailure);
            throw new UncheckedIOException("Failed to dead-letter " + item.id(), writeFailure);
        }
    }

    /**
     * Returns whether {@code itemId} has been dead-lettered.
     */
    public boolean contains(String itemId) {
        return Files.exists(directory.resolve(SafeFileNames.toSafeStem(itemId) + REASON_SUFFIX));
    }

    /**
     * Lists dead-lettered items, oldest first. Unreadable reason files are skipped with a warning.
     */
    public List<DeadLetterEntry> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<DeadLetterEntry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(file -> file.getFileName().toString().endsWith(REASON_SUFFIX))
                    .forEach(reasonFile -> readEntry(reasonFile).ifPresent(entries::add));
        } catch (IOException listFailure) {
            log.error("[DLQ] Failed to list {}", directory, listFailure);
            throw new UncheckedIOException("Failed to list dead-letter queue", listFailure);
        }
        entries.sort(Comparator.comparing(DeadLetterEntry::failedAt));
        return entries;
    }

    /**
     * Deletes entries that failed more than {@code retention} ago.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Duration retention) {
        Objects.requireNonNull(retention, "retention");
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (DeadLetterEntry entry : list()) {
            if (!entry.failedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                Files.deleteIfExists(entry.payloadFile());
                Files.deleteIfExists(entry.reasonFile());
                removed++;
            } catch (IOException deleteFailure) {
                log.error("[DLQ] Failed to purge {}", entry.itemId(), deleteFailure);
                throw new UncheckedIOException("Failed to purge " + entry.itemId(), deleteFailure);
            }
        }
        if (removed > 0) {
            log.info("[DLQ] Purged {} entries older than {}", removed, cutoff);
        }
        return removed;
    }

    public Path directory() {
        return directory;
    }

    private Path storePayload(WorkItem item, String stem) throws IOException {
        Optional<Path> source = item.source();
        if (source.isPresent() && Files.exists(source.get())) {
            Path destination = directory.resolve(stem + extensionOf(source.get()));
            Files.move(source.get(), destination, StandardCopyOption.REPLACE_EXISTING);
            return destination;
        }
        Path destination = directory.resolve(stem + PAYLOAD_SUFFIX);
        Files.writeString(destination, item.payload(), StandardCharsets.UTF_8);
        return destination;
    }

    private Optional<DeadLetterEntry> readEntry(Path reasonFile) {
        try {
            List<String> lines = Files.readAllLines(reasonFile, StandardCharsets.UTF_8);
            String itemId = null;
            String payloadName = null;
            Instant failedAt = null;
            StringBuilder reason = null;
            for (String line : lines) {
                if (reason != null) {
                    reason.append('\n').append(line);
                } else if (line.startsWith(ITEM_KEY)) {
                    itemId = line.substring(ITEM_KEY.length());
                } else if (line.startsWith(PAYLOAD_KEY)) {
                    payloadName = line.substring(PAYLOAD_KEY.length());
                } else if (line.startsWith(FAILED_AT_KEY)) {
                    failedAt = Instant.parse(line.substring(FAILED_AT_KEY.length()));
                } else if (line.startsWith(REASON_KEY)) {
                    reason = new StringBuilder(line.substring(REASON_KEY.length()));
                }
            }
            if (itemId == null || payloadName == null || failedAt == null || reason == null) {
                log.warn("[DLQ] Skipping incomplete reason file {}", reasonFile.getFileName());
                return Optional.empty();
            }
            return Optional.of(new DeadLetterEntry(
                    itemId, directory.resolve(payloadName), reasonFile, reason.toString().strip(), failedAt));
        } catch (IOException | DateTimeParseException readFailure) {
            log.warn("[DLQ] Skipping unreadable reason file {}: {}", reasonFile.getFileName(), readFailure.getMessage());
            return Optional.empty();
        }
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(dotIndex) : PAYLOAD_SUFFIX;
    }
}
