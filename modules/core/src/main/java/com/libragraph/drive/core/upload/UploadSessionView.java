package com.libragraph.drive.core.upload;

import com.libragraph.drive.core.dao.UploadSessionRecord;
import com.libragraph.drive.types.UploadStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

public record UploadSessionView(
        UUID sessionId,
        UUID ownerId,
        UUID fileId,
        String fileName,
        UploadStatus status,
        long declaredSize,
        long chunkSize,
        int expectedChunks,
        List<Integer> receivedChunks,
        List<Integer> missingChunks,
        Instant expiresAt,
        UUID resultFileId,
        Integer resultVersion,
        String failure
) {
    static UploadSessionView of(UploadSessionRecord s, List<Integer> received) {
        Set<Integer> have = new TreeSet<>(received);
        List<Integer> missing = new ArrayList<>();
        for (int i = 1; i <= s.expectedChunks(); i++) {
            if (!have.contains(i)) {
                missing.add(i);
            }
        }
        return new UploadSessionView(s.id(), s.ownerId(), s.fileId(), s.fileName(), s.status(),
                s.declaredSize(), s.chunkSize(), s.expectedChunks(), List.copyOf(have), List.copyOf(missing),
                s.expiresAt(), s.resultFileId(), s.resultVersion(), s.failure());
    }
}
