package com.williamcallahan.setforge.domain.checkpoint;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of opening a session for a run.
 *
 * @param state session metadata as of opening
 * @param outputFile absolute location of the session's output
 * @param resumed whether an existing incomplete session was reopened
 */
public record SessionHandle(SessionState state, Path outputFile, boolean resumed) {
    public SessionHandle {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(outputFile, "outputFile");
    }

    public String sessionId() {
        return state.sessionId();
    }

    public long currentCount() {
        return state.currentCount();
    }

    public boolean completed() {
        return state.completed();
    }
}
