package com.libragraph.drive.core.version;

import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.dao.FileVersionRecord;

/**
 * Result of recording a version.
 *
 * @param deduplicated the content was already stored for this owner and no new bytes were kept
 */
public record VersionOutcome(FileRecord record, FileVersionRecord version, boolean deduplicated) {

    /** Bytes this version added to physical storage. */
    public long physicalBytesAdded() {
        return deduplicated ? 0 : record.sizeBytes();
    }
}
