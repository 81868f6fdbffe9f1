package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record OutboxRecord(
        @ColumnName("id") long id,
        @ColumnName("event_id") UUID eventId,
        @ColumnName("event_type") String eventType,
        @ColumnName("payload") String payload,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("published_at") Instant publishedAt,
        @ColumnName("attempts") int attempts,
        @ColumnName("last_error") String lastError
) {}
