package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record QuotaReservationRecord(
        @ColumnName("id") UUID id,
        @ColumnName("owner_id") UUID ownerId,
        @ColumnName("bytes") long bytes,
        @ColumnName("created_at") Instant createdAt
) {}
