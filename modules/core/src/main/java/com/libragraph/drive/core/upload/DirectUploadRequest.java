package com.libragraph.drive.core.upload;

import com.libragraph.drive.util.ContentHash;

import java.util.Objects;
import java.util.UUID;

/**
 * Single-shot upload of content small enough to hold in memory.
 * Field semantics match {@link UploadRequest}.
 */
public record DirectUploadRequest(
        UUID ownerId,
        UUID fileId,
        String fileName,
        UUID folderId,
        String contentType,
        byte[] data,
        ContentHash expectedHash
) {
    public DirectUploadRequest {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(data, "data");
        if (fileId == null) {
            Objects.requireNonNull(fileName, "fileName");
        }
    }

    public static DirectUploadRequest newFile(UUID ownerId, String fileName, UUID folderId,
                                              String contentType, byte[] data) {
        return new DirectUploadRequest(ownerId, null, fileName, folderId, contentType, data, null);
    }

    public static DirectUploadRequest update(UUID ownerId, UUID fileId, String contentType, byte[] data) {
        return new DirectUploadRequest(ownerId, fileId, null, null, contentType, data, null);
    }

    public boolean isUpdate() {
        return fileId != null;
    }
}
