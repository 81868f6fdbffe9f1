package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record DeletionBatchRecord(
        @ColumnName("id") UUID id,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("root_folder_id") UUID rootFolderId,
        @ColumnName("deleted_at") Instant deletedAt,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("completed_at") Instant completedAt
) {}
