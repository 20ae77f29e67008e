package com.example.sqlgate.snapshot;

/**
 * A restore failed; the live tables were left as they were before the attempt.
 */
public class BackendException extends SnapshotException {

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
