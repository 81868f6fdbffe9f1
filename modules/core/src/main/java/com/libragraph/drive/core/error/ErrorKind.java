package com.libragraph.drive.core.error;

/**
 * Closed set of failure categories surfaced by the storage engine.
 */
public enum ErrorKind {
    /** Entity absent or soft-deleted. */
    NOT_FOUND(false),
    /** Duplicate key, mismatched duplicate chunk, or a lost race. */
    CONFLICT(false),
    /** Reservation would exceed the owner's limit. */
    QUOTA_EXCEEDED(false),
    /** Operation not permitted in the entity's current state. */
    INVALID_STATE(false),
    /** Hash or size mismatch detected at finalize. */
    INTEGRITY_FAILURE(false),
    /** Blob or metadata store transiently unreachable. */
    BACKEND_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
