package com.williamcallahan.setforge.domain.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted metadata of one generation session.
 *
 * <p>Serialized as the session file next to the session's output; the snake_case names are
 * the on-disk format.</p>
 *
 * @param sessionId unique session identifier
 * @param startTime when the session was created
 * @param outputFile output file name, relative to the checkpoint directory
 * @param targetSize number of recorded items that completes the session
 * @param qualityThreshold quality threshold the session was started with
 * @param currentCount number of durably recorded items
 * @param completed whether the target was reached
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionState(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("output_file") String outputFile,
        @JsonProperty("target_size") long targetSize,
        @JsonProperty("quality_threshold") double qualityThreshold,
        @JsonProperty("current_count") long currentCount,
        @JsonProperty("completed") boolean completed) {

    public SessionState {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(outputFile, "outputFile");
        if (targetSize <= 0) {
            throw new IllegalArgumentException("targetSize must be positive");
        }
        if (currentCount < 0) {
            throw new IllegalArgumentException("currentCount must be non-negative");
        }
    }

    /**
     * Creates the state of a session that has not recorded anything yet.
     */
    public static SessionState start(String sessionId, Instant startTime, long targetSize, double qualityThreshold) {
        return new SessionState(sessionId, startTime, sessionId + ".jsonl", targetSize, qualityThreshold, 0, false);
    }

    public SessionState withCurrentCount(long count) {
        return new SessionState(sessionId, startTime, outputFile, targetSize, qualityThreshold, count, completed);
    }

    public SessionState markCompleted() {
        return new SessionState(sessionId, startTime, outputFile, targetSize, qualityThreshold, currentCount, true);
    }

    @JsonIgnore
    public SessionStatus status() {
        if (completed) {
            return SessionStatus.COMPLETED;
        }
        return currentCount == 0 ? SessionStatus.NEW : SessionStatus.IN_PROGRESS;
    }

    @JsonIgnore
    public boolean targetReached() {
        return currentCount >= targetSize;
    }
}
