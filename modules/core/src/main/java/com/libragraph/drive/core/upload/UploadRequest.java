package com.libragraph.drive.core.upload;

import com.libragraph.drive.util.ContentHash;

import java.util.Objects;
import java.util.UUID;

/**
 * Declared intent to upload a file of known size.
 *
 * @param fileId       existing file to receive a new version; null creates a new file
 * @param fileName     name of the new file; ignored for updates
 * @param folderId     folder of the new file; null places it at the owner's root
 * @param chunkSize    null uses {@code drive.upload.default-chunk-size}
 * @param expectedHash hash the client computed; null skips the check
 */
public record UploadRequest(
        UUID ownerId,
        UUID fileId,
        String fileName,
        UUID folderId,
        String contentType,
        long declaredSize,
        Long chunkSize,
        ContentHash expectedHash
) {
    public UploadRequest {
        Objects.requireNonNull(ownerId, "ownerId");
        if (fileId == null) {
            Objects.requireNonNull(fileName, "fileName");
        }
    }

    public static UploadRequest newFile(UUID ownerId, String fileName, UUID folderId,
                                        String contentType, long declaredSize) {
        return new UploadRequest(ownerId, null, fileName, folderId, contentType, declaredSize, null, null);
    }

    public static UploadRequest update(UUID ownerId, UUID fileId, String contentType, long declaredSize) {
        return new UploadRequest(ownerId, fileId, null, null, contentType, declaredSize, null, null);
    }

    public UploadRequest withChunkSize(long size) {
        return new UploadRequest(ownerId, fileId, fileName, folderId, contentType, declaredSize, size, expectedHash);
    }

    public UploadRequest withExpectedHash(ContentHash hash) {
        return new UploadRequest(ownerId, fileId, fileName, folderId, contentType, declaredSize, chunkSize, hash);
    }

    public boolean isUpdate() {
        return fileId != null;
    }
}
