package com.libragraph.drive.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Used as the deduplication key and as the integrity check for finalized uploads.
 */
public record ContentHash(byte[] bytes) {
    public static final int HASH_LENGTH = 32;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates ContentHash from hex string (64 characters, either case).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
