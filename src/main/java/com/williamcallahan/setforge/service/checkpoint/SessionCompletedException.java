package com.williamcallahan.setforge.service.checkpoint;

/**
 * Thrown when an item is recorded against a session that already reached its target.
 */
public class SessionCompletedException extends IllegalStateException {

    public SessionCompletedException(String sessionId, long targetSize) {
        super("Session " + sessionId + " already reached its target of " + targetSize);
    }
}
