package com.libragraph.drive.types;

/**
 * Default storage limits per account tier.
 */
public enum QuotaTier {
    USER(0, "user", 10L * 1024 * 1024 * 1024),
    PREMIUM(1, "premium", 100L * 1024 * 1024 * 1024),
    ADMIN(2, "admin", 1024L * 1024 * 1024 * 1024);

    private final int id;
    private final String label;
    private final long limitBytes;

    QuotaTier(int id, String label, long limitBytes) {
        this.id = id;
        this.label = label;
        this.limitBytes = limitBytes;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public long limitBytes() {
        return limitBytes;
    }

    public static QuotaTier fromLabel(String label) {
        for (QuotaTier t : values()) {
            if (t.label.equalsIgnoreCase(label)) return t;
        }
        throw new IllegalArgumentException("Unknown QuotaTier: " + label);
    }
}
