package io.opscan.snapshot;

/**
 * Thrown when a compilation snapshot is malformed or references symbols inconsistently.
 */
public class SnapshotException extends Exception {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
