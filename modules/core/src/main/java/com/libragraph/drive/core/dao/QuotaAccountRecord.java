package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record QuotaAccountRecord(
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("quota_limit") long quotaLimit,
        @ColumnName("used_bytes") long usedBytes,
        @ColumnName("reserved_bytes") long reservedBytes,
        @ColumnName("updated_at") Instant updatedAt
) {
    public long available() {
        return Math.max(0, quotaLimit - usedBytes - reservedBytes);
    }
}
