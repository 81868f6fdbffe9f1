package com.libragraph.drive.util;

import java.util.Objects;

/**
 * Address of an object in the blob store.
 *
 * <p>String form: {@code {bucket}/{key}}. Keys may contain {@code /}, buckets may not.
 */
public record BlobLocation(String bucket, String key) {

    public BlobLocation {
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        if (bucket.isBlank() || bucket.contains("/")) {
            throw new IllegalArgumentException("Invalid bucket: '" + bucket + "'");
        }
        if (key.isBlank() || key.startsWith("/")) {
            throw new IllegalArgumentException("Invalid key: '" + key + "'");
        }
    }

    /**
     * Parses {@code bucket/key}.
     */
    public static BlobLocation parse(String s) {
        Objects.requireNonNull(s, "location string cannot be null");
        int slash = s.indexOf('/');
        if (slash <= 0 || slash == s.length() - 1) {
            throw new IllegalArgumentException("Invalid blob location: " + s);
        }
        return new BlobLocation(s.substring(0, slash), s.substring(slash + 1));
    }

    public BlobLocation withKey(String newKey) {
        return new BlobLocation(bucket, newKey);
    }

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
