package com.williamcallahan.setforge.service.checkpoint;

/**
 * Session output or metadata could not be written or read.
 */
public class CheckpointPersistenceException extends RuntimeException {

    public CheckpointPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
