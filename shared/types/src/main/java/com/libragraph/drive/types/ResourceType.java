package com.libragraph.drive.types;

public enum ResourceType {
    FILE(0, "file"),
    FOLDER(1, "folder");

    private final int id;
    private final String label;

    ResourceType(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ResourceType fromId(int id) {
        for (ResourceType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown ResourceType id: " + id);
    }
}
