package com.libragraph.drive.types;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse classification of stored content, derived from its MIME type.
 */
public enum ContentCategory {
    IMAGE(0, "image", true),
    VIDEO(1, "video", false),
    DOCUMENT(2, "document", true),
    OTHER(3, "other", false);

    private static final Set<String> DOCUMENT_TYPES = Set.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-powerpoint",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation",
            "text/plain",
            "text/csv");

    private final int id;
    private final String label;
    private final boolean compressible;

    ContentCategory(int id, String label, boolean compressible) {
        this.id = id;
        this.label = label;
        this.compressible = compressible;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean compressible() {
        return compressible;
    }

    /**
     * Classifies a MIME type. Parameters such as {@code ; charset=utf-8} are ignored.
     * A null or blank type is {@link #OTHER}.
     */
    public static ContentCategory fromMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return OTHER;
        }
        String base = mimeType.toLowerCase(Locale.ROOT);
        int semi = base.indexOf(';');
        if (semi >= 0) {
            base = base.substring(0, semi);
        }
        base = base.trim();
        if (base.startsWith("image/")) return IMAGE;
        if (base.startsWith("video/")) return VIDEO;
        if (DOCUMENT_TYPES.contains(base)) return DOCUMENT;
        return OTHER;
    }
}
