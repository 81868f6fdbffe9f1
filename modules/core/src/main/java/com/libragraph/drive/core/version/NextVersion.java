package com.libragraph.drive.core.version;

import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;

import java.util.Objects;
import java.util.UUID;

/**
 * New content for an existing file.
 *
 * @param contentType replaces the file's content type when non-null
 * @param uploadKey   see {@link NewFile#uploadKey()}
 */
public record NextVersion(
        UUID fileId,
        BlobLocation location,
        ContentHash hash,
        long sizeBytes,
        String description,
        UUID actor,
        String contentType,
        String uploadKey
) {
    public NextVersion {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(actor, "actor");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }
}
