package com.libragraph.drive.core.dao;

import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record BlobObjectRecord(
        @ColumnName("id") UUID id,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("content_hash") ContentHash contentHash,
        @ColumnName("bucket") String bucket,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("ref_count") int refCount,
        @ColumnName("created_at") Instant createdAt
) {
    public BlobLocation location() {
        return new BlobLocation(bucket, storageKey);
    }
}
