package com.portkit.core.checkpoint;

/**
 * Raised when checkpoint state cannot be read or durably written.
 *
 * <p>Always aborts the run: continuing without durable state would break resume.
 */
public class CheckpointStorageException extends RuntimeException {

    public CheckpointStorageException(String message) {
        super(message);
    }

    public CheckpointStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
