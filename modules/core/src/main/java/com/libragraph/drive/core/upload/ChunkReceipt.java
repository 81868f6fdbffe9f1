package com.libragraph.drive.core.upload;

import java.util.UUID;

/**
 * Acknowledgement of one chunk.
 *
 * @param duplicate  the same bytes were already received for this index
 * @param completion set when this chunk was the last outstanding one and the upload completed
 */
public record ChunkReceipt(
        UUID sessionId,
        int chunkIndex,
        String contentTag,
        long sizeBytes,
        boolean duplicate,
        int receivedChunks,
        int expectedChunks,
        UploadResult completion
) {
    public boolean isLast() {
        return receivedChunks == expectedChunks;
    }

    ChunkReceipt withCompletion(UploadResult result) {
        return new ChunkReceipt(sessionId, chunkIndex, contentTag, sizeBytes, duplicate,
                receivedChunks, expectedChunks, result);
    }
}
