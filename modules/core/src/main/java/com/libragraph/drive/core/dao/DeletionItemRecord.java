package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.ResourceType;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.util.UUID;

public record DeletionItemRecord(
        @ColumnName("batch_id") UUID batchId,
        @ColumnName("seq") int seq,
        @ColumnName("resource_type") ResourceType resourceType,
        @ColumnName("resource_id") UUID resourceId,
        @ColumnName("applied") boolean applied
) {}
