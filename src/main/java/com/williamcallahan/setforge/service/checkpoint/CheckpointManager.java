package com.williamcallahan.setforge.service.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.checkpoint.GeneratedArtifact;
import com.williamcallahan.setforge.domain.checkpoint.ProgressSnapshot;
import com.williamcallahan.setforge.domain.checkpoint.SessionHandle;
import com.williamcallahan.setforge.domain.checkpoint.SessionState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists generation progress so an interrupted run can resume where it stopped.
 *
 * <p>Each session owns two files in the checkpoint directory: {@code <session_id>.json} with the
 * session metadata and {@code <session_id>.jsonl} with one generated artifact per line. An
 * artifact line is forced to disk before {@code current_count} is incremented, and the metadata is
 * replaced by an atomic move, so the count never exceeds what is durably stored. On resume the
 * count is reconciled with the complete lines actually present and a torn trailing line left by a
 * crash is truncated.</p>
 *
 * <p>All writes go through one lock.</p>
 */
@Service
public class CheckpointManager {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private static final String SESSION_PREFIX = "session_";
    private static final String SESSION_SUFFIX = ".json";
    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);
    private static final byte NEWLINE = '\n';

    private final Path directory;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile SessionState activeSession;

    public CheckpointManager(AppProperties appProperties, ObjectMapper objectMapper, Clock clock) {
        this.directory = Path.of(appProperties.getCheckpoint().getDir());
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Opens the session for a run.
     *
     * @param targetSize recorded items that complete a fresh session
     * @param qualityThreshold threshold stored with a fresh session
     * @param resume reopen the latest incomplete session when one exists
     * @return the opened session
     * @throws CheckpointPersistenceException when the session cannot be written
     */
    public SessionHandle initializeSession(long targetSize, double qualityThreshold, boolean resume) {
        writeLock.lock();
        try {
            Files.createDirectories(directory);
            if (resume) {
                Optional<SessionState> latest = latestIncompleteSession();
                if (latest.isPresent()) {
                    SessionState reconciled = reconcile(latest.get());
                    activeSession = reconciled;
                    log.info(
                            "[CHECKPOINT] Resuming session {} at {}/{}",
                            reconciled.sessionId(),
                            reconciled.currentCount(),
                            reconciled.targetSize());
                    return new SessionHandle(reconciled, outputPath(reconciled), true);
                }
                log.info("[CHECKPOINT] No incomplete session found; starting a new one");
            }
            SessionState fresh = SessionState.start(newSessionId(), clock.instant(), targetSize, qualityThreshold);
            writeSession(fresh);
            activeSession = fresh;
            log.info("[CHECKPOINT] Started session {} with target {}", fresh.sessionId(), targetSize);
            return new SessionHandle(fresh, outputPath(fresh), false);
        } catch (IOException sessionFailure) {
            log.error("[CHECKPOINT] Failed to initialize session under {}", directory, sessionFailure);
            throw new CheckpointPersistenceException("Failed to initialize session", sessionFailure);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Durably appends one artifact and advances the session count.
     *
     * @return true when this item completed the session
     * @throws IllegalStateException when no session is active
     * @throws SessionCompletedException when the session already reached its target
     * @throws CheckpointPersistenceException when the artifact or metadata cannot be written
     */
    public boolean recordItem(GeneratedArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        writeLock.lock();
        try {
            SessionState session = activeSession;
            if (session == null) {
                throw new IllegalStateException("No active session; call initializeSession first");
            }
            if (session.completed()) {
                throw new SessionCompletedException(session.sessionId(), session.targetSize());
            }
            appendLine(outputPath(session), lineWriter.writeValueAsString(artifact));
            SessionState updated = session.withCurrentCount(session.currentCount() + 1);
            boolean justCompleted = updated.targetReached();
            if (justCompleted) {
                updated = updated.markCompleted();
            }
            writeSession(updated);
            activeSession = updated;
            if (justCompleted) {
                log.info("[CHECKPOINT] Session {} reached its target of {}", updated.sessionId(), updated.targetSize());
            }
            return justCompleted;
        } catch (IOException writeFailure) {
            log.error("[CHECKPOINT] Failed to record item {}", artifact.itemId(), writeFailure);
            throw new CheckpointPersistenceException("Failed to record item " + artifact.itemId(), writeFailure);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Progress of the active session, or {@link ProgressSnapshot#none()} when none is open.
     */
    public ProgressSnapshot getProgress() {
        SessionState session = activeSession;
        return session == null ? ProgressSnapshot.none() : ProgressSnapshot.of(session);
    }

    public boolean isCompleted() {
        SessionState session = activeSession;
        return session != null && session.completed();
    }

    /**
     * Item ids already present in the active session's output.
     */
    public Set<String> completedItemIds() {
        SessionState session = activeSession;
        if (session == null) {
            return Set.of();
        }
        Path output = outputPath(session);
        if (!Files.exists(output)) {
            return Set.of();
        }
        Set<String> itemIds = new HashSet<>();
        try (BufferedReader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = objectMapper.readTree(line);
                String itemId = node.path("item_id").asText("");
                if (!itemId.isEmpty()) {
                    itemIds.add(itemId);
                }
            }
        } catch (IOException readFailure) {
            log.error("[CHECKPOINT] Failed to read output {}", output, readFailure);
            throw new CheckpointPersistenceException("Failed to read session output", readFailure);
        }
        return itemIds;
    }

    /**
     * All readable sessions in the checkpoint directory, oldest first.
     */
    public List<SessionState> listSessions() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<SessionState> sessions = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(CheckpointManager::isSessionFile).forEach(file -> readSession(file).ifPresent(sessions::add));
        } catch (IOException listFailure) {
            throw new UncheckedIOException("Failed to list sessions in " + directory, listFailure);
        }
        sessions.sort(Comparator.comparing(SessionState::startTime));
        return sessions;
    }

    /**
     * The most recently started session that has not reached its target.
     */
    public Optional<SessionState> latestIncompleteSession() {
        return listSessions().stream()
                .filter(session -> !session.completed())
                .max(Comparator.comparing(SessionState::startTime));
    }

    /**
     * Deletes completed sessions, with their output, last modified more than {@code keepDays} ago.
     *
     * @return number of sessions removed
     */
    public int cleanupOldSessions(int keepDays) {
        if (keepDays < 0) {
            throw new IllegalArgumentException("keepDays must be non-negative");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(keepDays));
        writeLock.lock();
        try {
            int removed = 0;
            for (SessionState session : listSessions()) {
                if (!session.completed() || isActive(session)) {
                    continue;
                }
                Path sessionFile = sessionPath(session.sessionId());
                if (!Files.getLastModifiedTime(sessionFile).toInstant().isBefore(cutoff)) {
                    continue;
                }
                Files.deleteIfExists(outputPath(session));
                Files.deleteIfExists(sessionFile);
                removed++;
                log.info("[CHECKPOINT] Removed old session {}", session.sessionId());
            }
            return removed;
        } catch (IOException cleanupFailure) {
            log.error("[CHECKPOINT] Failed to clean up sessions in {}", directory, cleanupFailure);
            throw new CheckpointPersistenceException("Failed to clean up sessions", cleanupFailure);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Rewrites the active session's metadata; called on shutdown.
     */
    public void flush() {
        writeLock.lock();
        try {
            SessionState session = activeSession;
            if (session != null) {
                writeSession(session);
                log.info(
                        "[CHECKPOINT] Flushed session {} at {}/{}",
                        session.sessionId(),
                        session.currentCount(),
                        session.targetSize());
            }
        } catch (IOException flushFailure) {
            log.error("[CHECKPOINT] Failed to flush session metadata", flushFailure);
            throw new CheckpointPersistenceException("Failed to flush session", flushFailure);
        } finally {
            writeLock.unlock();
        }
    }

    public Path directory() {
        return directory;
    }

    private SessionState reconcile(SessionState session) throws IOException {
        long durableCount = countCompleteLines(outputPath(session));
        if (durableCount == session.currentCount()) {
            return session;
        }
        log.warn(
                "[CHECKPOINT] Session {} recorded {} items but its output holds {}; using the output count",
                session.sessionId(),
                session.currentCount(),
                durableCount);
        SessionState reconciled = session.withCurrentCount(durableCount);
        if (reconciled.targetReached()) {
            reconciled = reconciled.markCompleted();
        }
        writeSession(reconciled);
        return reconciled;
    }

    /**
     * Counts newline-terminated lines and truncates any bytes after the last newline.
     */
    private long countCompleteLines(Path output) throws IOException {
        if (!Files.exists(output)) {
            return 0;
        }
        long lines = 0;
        long lastNewlineEnd = 0;
        long position = 0;
        byte[] buffer = new byte[8192];
        try (InputStream input = Files.newInputStream(output)) {
            int read;
            while ((read = input.read(buffer)) != -1) {
                for (int index = 0; index < read; index++) {
                    if (buffer[index] == NEWLINE) {
                        lines++;
                        lastNewlineEnd = position + index + 1;
                    }
                }
                position += read;
            }
        }
        if (position > lastNewlineEnd) {
            log.warn("[CHECKPOINT] Truncating {} bytes of partial output in {}", position - lastNewlineEnd, output.getFileName());
            try (FileChannel channel = FileChannel.open(output, StandardOpenOption.WRITE)) {
                channel.truncate(lastNewlineEnd);
                channel.force(true);
            }
        }
        return lines;
    }

    private void appendLine(Path output, String json) throws IOException {
        ByteBuffer bytes = ByteBuffer.wrap((json + "\n").getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(
                output, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (bytes.hasRemaining()) {
                channel.write(bytes);
            }
            channel.force(true);
        }
    }

    private void writeSession(SessionState session) throws IOException {
        Path target = sessionPath(session.sessionId());
        Path temp = directory.resolve(session.sessionId() + SESSION_SUFFIX + ".tmp");
        Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(session));
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException atomicUnsupported) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Optional<SessionState> readSession(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SessionState.class));
        } catch (IOException | IllegalArgumentException readFailure) {
            log.warn("[CHECKPOINT] Skipping unreadable session file {}: {}", file.getFileName(), readFailure.getMessage());
            return Optional.empty();
        }
    }

    private String newSessionId() {
        String base = SESSION_PREFIX + SESSION_ID_FORMAT.format(clock.instant());
        String candidate = base;
        for (int suffix = 2; Files.exists(sessionPath(candidate)); suffix++) {
            candidate = base + "_" + suffix;
        }
        return candidate;
    }

    private boolean isActive(SessionState session) {
        SessionState active = activeSession;
        return active != null && active.sessionId().equals(session.sessionId());
    }

    private Path sessionPath(String sessionId) {
        return directory.resolve(sessionId + SESSION_SUFFIX);
    }

    private Path outputPath(SessionState session) {
        return directory.resolve(session.outputFile());
    }

    private static boolean isSessionFile(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith(SESSION_PREFIX) && name.endsWith(SESSION_SUFFIX);
    }
}
