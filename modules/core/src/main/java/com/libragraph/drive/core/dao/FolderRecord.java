package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * A folder row. {@code path} is the materialized path: {@code /Name} at top level,
 * {@code /Parent/Name} below.
 */
public record FolderRecord(
        @ColumnName("id") UUID id,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("name") String name,
        @ColumnName("parent_id") UUID parentId,
        @ColumnName("path") String path,
        @ColumnName("color") String color,
        @ColumnName("icon") String icon,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("deleted_at") Instant deletedAt
) {
    public boolean isActive() {
        return deletedAt == null;
    }

    public boolean isRootLevel() {
        return parentId == null;
    }

    public int depth() {
        String trimmed = path.replaceAll("^/+|/+$", "");
        if (trimmed.isEmpty()) {
            return 0;
        }
        return (int) trimmed.chars().filter(c -> c == '/').count() + 1;
    }

    /** Path of the parent folder, or empty at top level. */
    public String parentPath() {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash <= 0 ? "" : path.substring(0, lastSlash);
    }
}
