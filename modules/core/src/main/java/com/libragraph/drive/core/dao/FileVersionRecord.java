package com.libragraph.drive.core.dao;

import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one version of a file. Only {@code restoredAt}/{@code restoredFrom}
 * change after insert.
 */
public record FileVersionRecord(
        @ColumnName("id") UUID id,
        @ColumnName("file_id") UUID fileId,
        @ColumnName("version_number") int versionNumber,
        @ColumnName("bucket") String bucket,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("blob_id") UUID blobId,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("content_hash") ContentHash contentHash,
        @ColumnName("description") String description,
        @ColumnName("created_by") UUID createdBy,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("restored_at") Instant restoredAt,
        @ColumnName("restored_from") Integer restoredFrom
) {
    public BlobLocation location() {
        return new BlobLocation(bucket, storageKey);
    }

    public boolean wasRestored() {
        return restoredAt != null;
    }

    public boolean sameContentAs(FileVersionRecord other) {
        return contentHash.equals(other.contentHash);
    }
}
