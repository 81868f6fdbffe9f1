package com.libragraph.drive.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * Descriptor of a received chunk. {@code contentTag} identifies the bytes the client sent,
 * {@code partTag} is what the blob store returned for them.
 */
public record UploadChunkRecord(
        @ColumnName("session_id") UUID sessionId,
        @ColumnName("chunk_index") int chunkIndex,
        @ColumnName("content_tag") String contentTag,
        @ColumnName("part_tag") String partTag,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("received_at") Instant receivedAt
) {}
