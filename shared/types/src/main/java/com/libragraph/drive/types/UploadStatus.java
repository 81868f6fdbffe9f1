package com.libragraph.drive.types;

/**
 * Lifecycle of a chunked upload session.
 *
 * <p>{@code INITIATED -> IN_PROGRESS -> COMPLETING -> COMPLETED}, with {@code ABORTED}
 * reachable from every non-terminal state.
 */
public enum UploadStatus {
    INITIATED(0, "initiated"),
    IN_PROGRESS(1, "in_progress"),
    COMPLETING(2, "completing"),
    COMPLETED(3, "completed"),
    ABORTED(4, "aborted");

    private final int id;
    private final String label;

    UploadStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    /** Whether chunks may still be accepted. */
    public boolean acceptsChunks() {
        return this == INITIATED || this == IN_PROGRESS;
    }

    public static UploadStatus fromId(int id) {
        for (UploadStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown UploadStatus id: " + id);
    }
}
