package com.tinykv.snapshot;

/**
 * Exception thrown when a snapshot cannot be captured or restored.
 */
public class SnapshotException extends RuntimeException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
