package com.libragraph.drive.core.quota;

import java.time.Instant;
import java.util.UUID;

/**
 * Provisional hold on quota, later committed or released.
 */
public record Reservation(UUID id, UUID ownerId, long bytes, Instant createdAt) {}
