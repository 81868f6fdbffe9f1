package com.libragraph.drive.core.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Change notification for downstream consumers (processing, notification).
 *
 * <p>Delivery is at-least-once; consumers deduplicate on {@link #dedupKey()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorageEvent(
        UUID eventId,
        String eventType,
        UUID ownerId,
        UUID fileId,
        UUID folderId,
        Integer versionNumber,
        Long sizeBytes,
        String contentHash,
        Instant occurredAt
) {
    public static final String VERSION_CREATED = "version.created";
    public static final String DELETED = "deleted";

    public static StorageEvent versionCreated(UUID ownerId, UUID fileId, int versionNumber,
                                              long sizeBytes, String contentHash, Instant at) {
        return new StorageEvent(UUID.randomUUID(), VERSION_CREATED, ownerId, fileId, null,
                versionNumber, sizeBytes, contentHash, at);
    }

    public static StorageEvent fileDeleted(UUID ownerId, UUID fileId, Instant at) {
        return new StorageEvent(UUID.randomUUID(), DELETED, ownerId, fileId, null,
                null, null, null, at);
    }

    public static StorageEvent folderDeleted(UUID ownerId, UUID folderId, Instant at) {
        return new StorageEvent(UUID.randomUUID(), DELETED, ownerId, null, folderId,
                null, null, null, at);
    }

    @JsonIgnore
    public String dedupKey() {
        if (VERSION_CREATED.equals(eventType)) {
            return fileId + ":" + versionNumber;
        }
        return (fileId != null ? fileId : folderId) + ":" + eventType;
    }
}
