package com.libragraph.drive.types;

/**
 * Background processing state of a file version (thumbnails, metadata extraction).
 */
public enum ProcessingStatus {
    PENDING(0, "pending"),
    PROCESSING(1, "processing"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    ProcessingStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ProcessingStatus fromId(int id) {
        for (ProcessingStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown ProcessingStatus id: " + id);
    }
}
