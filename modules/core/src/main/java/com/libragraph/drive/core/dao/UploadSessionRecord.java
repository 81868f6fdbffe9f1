package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.UploadStatus;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent state of a chunked upload. {@code fileId} is set when the upload
 * replaces the content of an existing file.
 */
public record UploadSessionRecord(
        @ColumnName("id") UUID id,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("file_id") UUID fileId,
        @ColumnName("file_name") String fileName,
        @ColumnName("folder_id") UUID folderId,
        @ColumnName("content_type") String contentType,
        @ColumnName("declared_size") long declaredSize,
        @ColumnName("chunk_size") long chunkSize,
        @ColumnName("expected_chunks") int expectedChunks,
        @ColumnName("bucket") String bucket,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("multipart_id") String multipartId,
        @ColumnName("reservation_id") UUID reservationId,
        @ColumnName("expected_hash") ContentHash expectedHash,
        @ColumnName("status") UploadStatus status,
        @ColumnName("result_file_id") UUID resultFileId,
        @ColumnName("result_version") Integer resultVersion,
        @ColumnName("warning") String warning,
        @ColumnName("failure") String failure,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("expires_at") Instant expiresAt
) {
    public BlobLocation location() {
        return new BlobLocation(bucket, storageKey);
    }

    public boolean isUpdate() {
        return fileId != null;
    }

    public UploadSessionRecord withStatus(UploadStatus newStatus) {
        return new UploadSessionRecord(id, ownerId, fileId, fileName, folderId, contentType, declaredSize,
                chunkSize, expectedChunks, bucket, storageKey, multipartId, reservationId, expectedHash,
                newStatus, resultFileId, resultVersion, warning, failure, createdAt, updatedAt, expiresAt);
    }
}
