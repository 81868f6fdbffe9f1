package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.FilePermission;
import com.libragraph.drive.types.ResourceType;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record ShareRecord(
        @ColumnName("resource_id") UUID resourceId,
        @ColumnName("resource_type") ResourceType resourceType,
        @ColumnName("grantee_id") UUID granteeId,
        @ColumnName("permission") FilePermission permission,
        @ColumnName("shared_by") UUID sharedBy,
        @ColumnName("shared_at") Instant sharedAt
) {}
