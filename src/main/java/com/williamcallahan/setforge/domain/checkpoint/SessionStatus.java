package com.williamcallahan.setforge.domain.checkpoint;

/**
 * Lifecycle of a generation session.
 */
public enum SessionStatus {
    NEW,
    IN_PROGRESS,
    COMPLETED
}
