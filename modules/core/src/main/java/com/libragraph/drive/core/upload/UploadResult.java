package com.libragraph.drive.core.upload;

import com.libragraph.drive.util.ContentHash;

import java.util.List;
import java.util.UUID;

/**
 * The version an upload produced.
 *
 * @param sessionId null for direct uploads
 * @param warnings  non-fatal discrepancies, e.g. stored size differing from the declared size
 */
public record UploadResult(
        UUID sessionId,
        UUID fileId,
        int versionNumber,
        long sizeBytes,
        ContentHash contentHash,
        boolean deduplicated,
        List<String> warnings
) {
    public UploadResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
