package com.williamcallahan.setforge.domain.checkpoint;

/**
 * Read-only view of session progress.
 *
 * @param sessionId active session, or empty when none is active
 * @param currentCount recorded items
 * @param targetSize items needed to complete
 * @param percentage completion percentage, 0-100
 * @param completed whether the session reached its target
 */
public record ProgressSnapshot(String sessionId, long currentCount, long targetSize, double percentage, boolean completed) {

    private static final ProgressSnapshot NONE = new ProgressSnapshot("", 0, 0, 0.0, false);

    public static ProgressSnapshot none() {
        return NONE;
    }

    public static ProgressSnapshot of(SessionState state) {
        double percentage = Math.min(100.0, state.currentCount() * 100.0 / state.targetSize());
        return new ProgressSnapshot(
                state.sessionId(), state.currentCount(), state.targetSize(), percentage, state.completed());
    }

    public boolean hasSession() {
        return !sessionId.isEmpty();
    }
}
