package com.libragraph.drive.types;

/**
 * Access level granted on a file or folder. Levels are ordered: ADMIN implies WRITE implies READ.
 */
public enum FilePermission {
    READ(0, "read"),
    WRITE(1, "write"),
    ADMIN(2, "admin");

    private final int id;
    private final String label;

    FilePermission(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean implies(FilePermission other) {
        return id >= other.id;
    }

    public static FilePermission strongest(FilePermission a, FilePermission b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.id >= b.id ? a : b;
    }

    public static FilePermission fromId(int id) {
        for (FilePermission p : values()) {
            if (p.id == id) return p;
        }
        throw new IllegalArgumentException("Unknown FilePermission id: " + id);
    }

    public static FilePermission fromLabel(String label) {
        for (FilePermission p : values()) {
            if (p.label.equalsIgnoreCase(label)) return p;
        }
        throw new IllegalArgumentException("Unknown FilePermission: " + label);
    }
}
