package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.ContentCategory;
import com.libragraph.drive.types.ProcessingStatus;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * One version row of a logical file. {@code fileId} is the lineage id shared by all
 * rows of the same file; {@code id} identifies the row itself.
 */
public record FileRecord(
        @ColumnName("id") UUID id,
        @ColumnName("file_id") UUID fileId,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("name") String name,
        @ColumnName("folder_id") UUID folderId,
        @ColumnName("bucket") String bucket,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("upload_key") String uploadKey,
        @ColumnName("blob_id") UUID blobId,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("content_type") String contentType,
        @ColumnName("content_hash") ContentHash contentHash,
        @ColumnName("version_number") int versionNumber,
        @ColumnName("is_current") boolean current,
        @ColumnName("parent_version_id") UUID parentVersionId,
        @ColumnName("processing_status") ProcessingStatus processingStatus,
        @ColumnName("metadata") String metadata,
        @ColumnName("thumbnail_key") String thumbnailKey,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("deleted_at") Instant deletedAt,
        @ColumnName("last_accessed_at") Instant lastAccessedAt
) {
    public BlobLocation location() {
        return new BlobLocation(bucket, storageKey);
    }

    public boolean isActive() {
        return deletedAt == null;
    }

    public ContentCategory category() {
        return ContentCategory.fromMimeType(contentType);
    }
}
