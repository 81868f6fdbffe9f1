package com.libragraph.drive.core.version;

import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;

import java.util.Objects;
import java.util.UUID;

/**
 * Everything needed to record version 1 of a new file.
 *
 * @param uploadKey deterministic key of the upload that produced the content; guards
 *                  against recording the same completion twice. May be null.
 */
public record NewFile(
        UUID ownerId,
        String name,
        UUID folderId,
        String contentType,
        BlobLocation location,
        ContentHash hash,
        long sizeBytes,
        String uploadKey
) {
    public NewFile {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(hash, "hash");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }
}
