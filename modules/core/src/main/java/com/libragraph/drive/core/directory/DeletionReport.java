package com.libragraph.drive.core.directory;

import java.util.UUID;

/**
 * Outcome of a folder deletion.
 *
 * @param complete false if applying stopped early; the recovery sweep finishes the batch
 */
public record DeletionReport(UUID batchId, int folders, int files, boolean complete) {}
