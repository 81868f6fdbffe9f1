package com.libragraph.drive.core.version;

import com.libragraph.drive.util.BlobLocation;

import java.util.List;

public record PruneResult(List<Integer> deletedVersions, List<BlobLocation> deletedBlobs, long reclaimedBytes) {

    public static PruneResult empty() {
        return new PruneResult(List.of(), List.of(), 0);
    }
}
