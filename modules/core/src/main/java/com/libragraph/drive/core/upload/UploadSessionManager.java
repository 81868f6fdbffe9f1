package com.libragraph.drive.core.upload;

import com.libragraph.drive.core.content.ContentAddresser;
import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.dao.FileRecordDao;
import com.libragraph.drive.core.dao.FileVersionDao;
import com.libragraph.drive.core.dao.FileVersionRecord;
import com.libragraph.drive.core.dao.UploadChunkDao;
import com.libragraph.drive.core.dao.UploadChunkRecord;
import com.libragraph.drive.core.dao.UploadSessionDao;
import com.libragraph.drive.core.dao.UploadSessionRecord;
import com.libragraph.drive.core.db.Constraints;
import com.libragraph.drive.core.directory.FileDirectory;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.quota.QuotaLedger;
import com.libragraph.drive.core.quota.Reservation;
import com.libragraph.drive.core.storage.BlobService;
import com.libragraph.drive.core.storage.MultipartHandle;
import com.libragraph.drive.core.storage.PartTag;
import com.libragraph.drive.core.version.NewFile;
import com.libragraph.drive.core.version.NextVersion;
import com.libragraph.drive.core.version.VersionOutcome;
import com.libragraph.drive.core.version.VersionStore;
import com.libragraph.drive.types.UploadStatus;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.KeyedLocks;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chunked upload lifecycle.
 *
 * <pre>
 * INITIATED -> IN_PROGRESS -> COMPLETING -> COMPLETED
 *      \____________\_____________\______-> ABORTED
 * </pre>
 *
 * <p>Chunks of one session upload in parallel under a shared session lock; the same chunk
 * index is serialized. Completion and abort take the session lock exclusively, so no chunk
 * is in flight while a session finalizes. Every status change is a compare-and-set on the
 * session row, which keeps concurrent completions and aborts in different processes from
 * both succeeding.
 */
@ApplicationScoped
public class UploadSessionManager {

    private static final Logger log = Logger.getLogger(UploadSessionManager.class);

    static final int MAX_CHUNKS = 10_000;

    private static final List<UploadStatus> OPEN_STATUSES =
            List.of(UploadStatus.INITIATED, UploadStatus.IN_PROGRESS, UploadStatus.COMPLETING);
    private static final List<UploadStatus> TERMINAL_STATUSES =
            List.of(UploadStatus.COMPLETED, UploadStatus.ABORTED);

    private final Jdbi jdbi;
    private final BlobService blobService;
    private final ContentAddresser addresser;
    private final VersionStore versionStore;
    private final FileDirectory directory;
    private final QuotaLedger quotaLedger;
    private final Clock clock;
    private final UploadSettings settings;

    private final KeyedLocks<UUID> sessionLocks = new KeyedLocks<>();
    private final KeyedLocks<String> chunkLocks = new KeyedLocks<>();

    @Inject
    public UploadSessionManager(Jdbi jdbi,
                                BlobService blobService,
                                ContentAddresser addresser,
                                VersionStore versionStore,
                                FileDirectory directory,
                                QuotaLedger quotaLedger,
                                Clock clock,
                                UploadSettings settings) {
        this.jdbi = jdbi;
        this.blobService = blobService;
        this.addresser = addresser;
        this.versionStore = versionStore;
        this.directory = directory;
        this.quotaLedger = quotaLedger;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Opens a session: validates the target, reserves the declared size and allocates the
     * multipart upload.
     *
     * @throws DriveException QUOTA_EXCEEDED if the owner cannot hold the declared size
     */
    public UploadSessionView initiate(UploadRequest request) {
        long size = request.declaredSize();
        if (size <= 0 || size > settings.maxFileSize()) {
            throw new IllegalArgumentException("Declared size must be in (0, " + settings.maxFileSize()
                    + "], got " + size);
        }
        long chunkSize = request.chunkSize() != null ? request.chunkSize() : settings.defaultChunkSize();
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be > 0, got " + chunkSize);
        }
        long chunks = (size + chunkSize - 1) / chunkSize;
        if (chunks > 1 && chunkSize < settings.minChunkSize()) {
            throw new IllegalArgumentException("Chunk size " + chunkSize + " is below the minimum "
                    + settings.minChunkSize() + " for an upload of " + chunks + " chunks");
        }
        if (chunks > MAX_CHUNKS) {
            throw new IllegalArgumentException("Upload of " + size + " bytes needs " + chunks
                    + " chunks of " + chunkSize + ", more than " + MAX_CHUNKS);
        }
        String fileName = resolveTarget(request.ownerId(), request.fileId(), request.fileName(), request.folderId());

        Reservation reservation = quotaLedger.reserve(request.ownerId(), size);
        UUID sessionId = UUID.randomUUID();
        BlobLocation location = new BlobLocation(settings.bucket(),
                "owners/" + request.ownerId() + "/uploads/" + sessionId);
        MultipartHandle handle;
        try {
            handle = blobService.initiateMultipart(location);
        } catch (RuntimeException e) {
            quotaLedger.release(request.ownerId(), reservation.id());
            throw e;
        }

        Instant now = clock.instant();
        UploadSessionRecord session = new UploadSessionRecord(sessionId, request.ownerId(), request.fileId(),
                fileName, request.folderId(), request.contentType(), size, chunkSize, (int) chunks,
                location.bucket(), location.key(), handle.uploadId(), reservation.id(), request.expectedHash(),
                UploadStatus.INITIATED, null, null, null, null, now, now, now.plus(settings.sessionTtl()));
        try {
            jdbi.useExtension(UploadSessionDao.class, dao -> dao.insert(session));
        } catch (RuntimeException e) {
            abortQuietly(handle);
            quotaLedger.release(request.ownerId(), reservation.id());
            throw e;
        }
        log.infof("Upload %s initiated by %s: %s, %d bytes in %d chunks",
                sessionId, request.ownerId(), fileName, size, chunks);
        return UploadSessionView.of(session, List.of());
    }

    /**
     * Accepts chunk {@code index} (1-based). Resending identical bytes for an index is a no-op.
     * Receiving the last outstanding chunk completes the upload.
     *
     * @throws DriveException CONFLICT if different bytes were already received for the index,
     *                        INVALID_STATE if the session no longer accepts chunks
     */
    public ChunkReceipt uploadChunk(UUID sessionId, int index, byte[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Chunk " + index + " is empty");
        }
        ChunkReceipt receipt = sessionLocks.withSharedLock(sessionId,
                () -> chunkLocks.withLock(sessionId + ":" + index, () -> receiveChunk(sessionId, index, data)));
        if (receipt.isLast() && !receipt.duplicate()) {
            return receipt.withCompletion(complete(sessionId));
        }
        return receipt;
    }

    private ChunkReceipt receiveChunk(UUID sessionId, int index, byte[] data) {
        UploadSessionRecord session = requireSession(sessionId);
        if (!session.status().acceptsChunks()) {
            throw DriveException.invalidState("Upload " + sessionId + " is " + session.status().label()
                    + " and no longer accepts chunks");
        }
        if (index < 1 || index > session.expectedChunks()) {
            throw new IllegalArgumentException("Chunk index " + index + " outside [1, "
                    + session.expectedChunks() + "]");
        }
        if (data.length > session.chunkSize()) {
            throw new IllegalArgumentException("Chunk " + index + " has " + data.length
                    + " bytes, more than the chunk size " + session.chunkSize());
        }
        String tag = addresser.chunkTag(data);
        Optional<UploadChunkRecord> existing = jdbi.withExtension(UploadChunkDao.class,
                dao -> dao.find(sessionId, index));
        if (existing.isPresent()) {
            return duplicate(session, existing.get(), tag);
        }

        PartTag part = blobService.uploadPart(handle(session), index, data);
        Instant now = clock.instant();
        UploadChunkRecord chunk = new UploadChunkRecord(sessionId, index, tag, part.tag(), data.length, now);
        try {
            jdbi.useTransaction(h -> {
                UploadSessionDao sessions = h.attach(UploadSessionDao.class);
                h.attach(UploadChunkDao.class).insert(chunk);
                if (sessions.transition(sessionId, UploadStatus.INITIATED, UploadStatus.IN_PROGRESS, now) == 0) {
                    sessions.touch(sessionId, now);
                }
            });
        } catch (JdbiException e) {
            if (!Constraints.isUniqueViolation(e)) {
                throw e;
            }
            UploadChunkRecord winner = jdbi.withExtension(UploadChunkDao.class,
                    dao -> dao.find(sessionId, index)).orElseThrow(() -> e);
            return duplicate(session, winner, tag);
        }
        // Counted after commit: of two chunks committing together, the later one sees both.
        int received = jdbi.withExtension(UploadChunkDao.class, dao -> dao.count(sessionId));
        log.debugf("Upload %s: chunk %d/%d (%d bytes)", sessionId, index, session.expectedChunks(), data.length);
        return new ChunkReceipt(sessionId, index, tag, data.length, false, received, session.expectedChunks(), null);
    }

    private ChunkReceipt duplicate(UploadSessionRecord session, UploadChunkRecord existing, String tag) {
        if (!existing.contentTag().equals(tag)) {
            throw DriveException.conflict("Chunk " + existing.chunkIndex() + " of upload " + session.id()
                    + " was already received with different content");
        }
        int received = jdbi.withExtension(UploadChunkDao.class, dao -> dao.count(session.id()));
        log.debugf("Upload %s: duplicate chunk %d ignored", session.id(), existing.chunkIndex());
        return new ChunkReceipt(session.id(), existing.chunkIndex(), tag, existing.sizeBytes(), true,
                received, session.expectedChunks(), null);
    }

    /**
     * Finalizes the upload and records the resulting version. Completing an already
     * completed session returns its recorded result.
     *
     * @throws DriveException INVALID_STATE if chunks are missing or the session was aborted,
     *                        INTEGRITY_FAILURE if size or hash checks fail (the session is aborted),
     *                        BACKEND_UNAVAILABLE if finalizing fails (the session stays COMPLETING)
     */
    public UploadResult complete(UUID sessionId) {
        return sessionLocks.withLock(sessionId, () -> completeExclusive(sessionId));
    }

    private UploadResult completeExclusive(UUID sessionId) {
        UploadSessionRecord session = requireSession(sessionId);
        switch (session.status()) {
            case COMPLETED:
                return recordedResult(session);
            case ABORTED:
                throw DriveException.invalidState("Upload " + sessionId + " was aborted");
            case COMPLETING:
                throw DriveException.invalidState("Upload " + sessionId
                        + " already attempted completion and must be aborted");
            default:
                break;
        }

        List<UploadChunkRecord> chunks = jdbi.withExtension(UploadChunkDao.class, dao -> dao.list(sessionId));
        List<Integer> missing = UploadSessionView.of(session,
                chunks.stream().map(UploadChunkRecord::chunkIndex).toList()).missingChunks();
        if (!missing.isEmpty()) {
            throw DriveException.invalidState("Upload " + sessionId + " is missing " + missing.size() + " chunk(s)",
                    Map.of("sessionId", sessionId, "missing", missing));
        }
        long received = chunks.stream().mapToLong(UploadChunkRecord::sizeBytes).sum();
        if (received != session.declaredSize()) {
            abortExclusive(session, "Received " + received + " bytes, declared " + session.declaredSize());
            throw DriveException.sizeMismatch(session.declaredSize(), received);
        }
        Instant now = clock.instant();
        int moved = jdbi.withExtension(UploadSessionDao.class,
                dao -> dao.transition(sessionId, session.status(), UploadStatus.COMPLETING, now));
        if (moved == 0) {
            throw DriveException.conflict("Upload " + sessionId + " changed state concurrently");
        }

        List<PartTag> parts = chunks.stream()
                .map(c -> new PartTag(c.chunkIndex(), c.partTag(), c.sizeBytes()))
                .toList();
        ContentAddresser.Digest digest;
        try {
            long stored = blobService.completeMultipart(handle(session), parts);
            log.debugf("Upload %s finalized: %d bytes at %s", sessionId, stored, session.location());
            digest = addresser.digest(session.location());
        } catch (DriveException e) {
            recordFailure(sessionId, e);
            throw e;
        }

        if (session.expectedHash() != null && !session.expectedHash().equals(digest.hash())) {
            abortExclusive(session.withStatus(UploadStatus.COMPLETING), "Content hash mismatch");
            throw DriveException.hashMismatch(session.expectedHash().toHex(), digest.hash().toHex());
        }
        List<String> warnings = new ArrayList<>();
        if (digest.size() != session.declaredSize()) {
            warnings.add("Stored size " + digest.size() + " differs from declared size " + session.declaredSize());
        }

        VersionOutcome outcome;
        try {
            outcome = recordVersion(session.ownerId(), session.fileId(), session.fileName(), session.folderId(),
                    session.contentType(), session.location(), digest, session.storageKey());
        } catch (DriveException e) {
            recordFailure(sessionId, e);
            throw e;
        }
        commitQuota(session.ownerId(), session.reservationId(), outcome.physicalBytesAdded(), warnings);
        markCompleted(session, outcome.record(), warnings);
        log.infof("Upload %s completed: file %s v%d (%d bytes%s)", sessionId, outcome.record().fileId(),
                outcome.record().versionNumber(), digest.size(), outcome.deduplicated() ? ", deduplicated" : "");
        return new UploadResult(sessionId, outcome.record().fileId(), outcome.record().versionNumber(),
                digest.size(), digest.hash(), outcome.deduplicated(), warnings);
    }

    /**
     * Cancels the session, releasing its reservation and staged bytes. Aborting an aborted
     * session is a no-op. The session row remains as a tombstone until purged.
     *
     * @throws DriveException INVALID_STATE if the session already completed
     */
    public UploadSessionView abort(UUID sessionId) {
        return sessionLocks.withLock(sessionId, () -> {
            UploadSessionRecord session = requireSession(sessionId);
            if (session.status() == UploadStatus.COMPLETED) {
                throw DriveException.invalidState("Upload " + sessionId + " already completed");
            }
            if (session.status() == UploadStatus.COMPLETING && recoverCompleted(session).isPresent()) {
                throw DriveException.invalidState("Upload " + sessionId + " already completed");
            }
            abortExclusive(session, "Aborted by client");
            return status(sessionId);
        });
    }

    public UploadSessionView status(UUID sessionId) {
        UploadSessionRecord session = requireSession(sessionId);
        List<Integer> received = jdbi.withExtension(UploadChunkDao.class, dao -> dao.list(sessionId)).stream()
                .map(UploadChunkRecord::chunkIndex)
                .toList();
        return UploadSessionView.of(session, received);
    }

    /**
     * Uploads content in one call, without a session.
     */
    public UploadResult uploadDirect(DirectUploadRequest request) {
        byte[] data = request.data();
        if (data.length > settings.maxFileSize()) {
            throw new IllegalArgumentException("Upload of " + data.length + " bytes exceeds the maximum of "
                    + settings.maxFileSize());
        }
        String fileName = resolveTarget(request.ownerId(), request.fileId(), request.fileName(), request.folderId());
        ContentAddresser.Digest digest = addresser.digest(data);
        if (request.expectedHash() != null && !request.expectedHash().equals(digest.hash())) {
            throw DriveException.hashMismatch(request.expectedHash().toHex(), digest.hash().toHex());
        }

        Reservation reservation = quotaLedger.reserve(request.ownerId(), data.length);
        String key = "owners/" + request.ownerId() + "/direct/" + UUID.randomUUID();
        BlobLocation location = new BlobLocation(settings.bucket(), key);
        VersionOutcome outcome;
        try {
            blobService.putObject(location, data, request.contentType());
        } catch (RuntimeException e) {
            quotaLedger.release(request.ownerId(), reservation.id());
            throw e;
        }
        try {
            outcome = recordVersion(request.ownerId(), request.fileId(), fileName, request.folderId(),
                    request.contentType(), location, digest, key);
        } catch (RuntimeException e) {
            quotaLedger.release(request.ownerId(), reservation.id());
            deleteQuietly(location);
            throw e;
        }
        List<String> warnings = new ArrayList<>();
        commitQuota(request.ownerId(), reservation.id(), outcome.physicalBytesAdded(), warnings);
        log.infof("Direct upload by %s: file %s v%d (%d bytes%s)", request.ownerId(), outcome.record().fileId(),
                outcome.record().versionNumber(), digest.size(), outcome.deduplicated() ? ", deduplicated" : "");
        return new UploadResult(null, outcome.record().fileId(), outcome.record().versionNumber(),
                digest.size(), digest.hash(), outcome.deduplicated(), warnings);
    }

    /**
     * Aborts sessions idle past the idle timeout or past their expiry. A session stuck in
     * COMPLETING whose version was already recorded is marked completed instead.
     *
     * @return number of sessions resolved
     */
    public int expireStaleSessions(int limit) {
        Instant now = clock.instant();
        List<UploadSessionRecord> stale = jdbi.withExtension(UploadSessionDao.class,
                dao -> dao.findStale(OPEN_STATUSES, now.minus(settings.idleTimeout()), now, limit));
        int resolved = 0;
        for (UploadSessionRecord candidate : stale) {
            boolean done = sessionLocks.withLock(candidate.id(), () -> {
                UploadSessionRecord session = requireSession(candidate.id());
                if (session.status().isTerminal()) {
                    return false;
                }
                if (session.status() == UploadStatus.COMPLETING && recoverCompleted(session).isPresent()) {
                    log.infof("Upload %s recovered as completed", session.id());
                    return true;
                }
                abortExclusive(session, "Expired");
                log.warnf("Upload %s expired in state %s, aborted", session.id(), session.status().label());
                return true;
            });
            if (done) {
                resolved++;
            }
        }
        return resolved;
    }

    /**
     * Deletes terminal sessions older than the tombstone retention.
     *
     * @return number of sessions deleted
     */
    public int purgeTombstones(int limit) {
        Instant cutoff = clock.instant().minus(settings.tombstoneRetention());
        return jdbi.inTransaction(h -> {
            UploadSessionDao sessions = h.attach(UploadSessionDao.class);
            int purged = 0;
            for (UUID id : sessions.findTombstones(TERMINAL_STATUSES, cutoff, limit)) {
                purged += sessions.delete(id);
            }
            return purged;
        });
    }

    private VersionOutcome recordVersion(UUID ownerId, UUID fileId, String fileName, UUID folderId,
                                         String contentType, BlobLocation location,
                                         ContentAddresser.Digest digest, String uploadKey) {
        if (fileId == null) {
            return versionStore.createInitialVersion(new NewFile(ownerId, fileName, folderId, contentType,
                    location, digest.hash(), digest.size(), uploadKey));
        }
        return versionStore.createNextVersion(new NextVersion(fileId, location, digest.hash(), digest.size(),
                "Uploaded new content", ownerId, contentType, uploadKey));
    }

    /**
     * Validates where the upload lands.
     *
     * @return the file name the upload will carry
     */
    private String resolveTarget(UUID ownerId, UUID fileId, String fileName, UUID folderId) {
        if (fileId != null) {
            FileRecord current = versionStore.current(fileId);
            if (!current.ownerId().equals(ownerId)) {
                throw DriveException.notFound("File", fileId);
            }
            return current.name();
        }
        FileDirectory.validateName(fileName);
        if (folderId != null) {
            directory.requireActiveFolder(ownerId, folderId);
        }
        return fileName;
    }

    private void commitQuota(UUID ownerId, UUID reservationId, long physicalBytes, List<String> warnings) {
        try {
            quotaLedger.commit(ownerId, reservationId, physicalBytes);
        } catch (DriveException e) {
            log.warnf("Quota commit for reservation %s failed: %s", reservationId, e.getMessage());
            warnings.add("Quota was not charged: " + e.getMessage());
        }
    }

    private void markCompleted(UploadSessionRecord session, FileRecord file, List<String> warnings) {
        String warning = warnings.isEmpty() ? null : String.join("; ", warnings);
        int updated = jdbi.withExtension(UploadSessionDao.class, dao -> dao.markCompleted(session.id(),
                file.fileId(), file.versionNumber(), warning,
                UploadStatus.COMPLETING, UploadStatus.COMPLETED, clock.instant()));
        if (updated == 0) {
            log.warnf("Upload %s left COMPLETING before it could be marked completed", session.id());
        }
    }

    /**
     * Finishes a session whose version exists but whose completion was never recorded.
     */
    private Optional<UploadResult> recoverCompleted(UploadSessionRecord session) {
        Optional<FileRecord> recorded = jdbi.withExtension(FileRecordDao.class,
                dao -> dao.findByUploadKey(session.storageKey()));
        if (recorded.isEmpty()) {
            return Optional.empty();
        }
        FileRecord file = recorded.get();
        boolean deduplicated = !file.storageKey().equals(session.storageKey());
        List<String> warnings = new ArrayList<>();
        commitQuota(session.ownerId(), session.reservationId(), deduplicated ? 0 : file.sizeBytes(), warnings);
        markCompleted(session, file, warnings);
        return Optional.of(new UploadResult(session.id(), file.fileId(), file.versionNumber(), file.sizeBytes(),
                file.contentHash(), deduplicated, warnings));
    }

    private UploadResult recordedResult(UploadSessionRecord session) {
        FileVersionRecord version = jdbi.withExtension(FileVersionDao.class,
                dao -> dao.find(session.resultFileId(), session.resultVersion())).orElseThrow();
        List<String> warnings = session.warning() == null ? List.of() : Arrays.asList(session.warning().split("; "));
        return new UploadResult(session.id(), session.resultFileId(), session.resultVersion(), version.sizeBytes(),
                version.contentHash(), !version.storageKey().equals(session.storageKey()), warnings);
    }

    /** Caller holds the session lock exclusively. */
    private void abortExclusive(UploadSessionRecord session, String reason) {
        int updated = jdbi.withExtension(UploadSessionDao.class, dao -> dao.markAborted(session.id(), reason,
                OPEN_STATUSES, UploadStatus.ABORTED, clock.instant()));
        if (updated == 0) {
            UploadSessionRecord now = requireSession(session.id());
            if (now.status() == UploadStatus.ABORTED) {
                return;
            }
            throw DriveException.invalidState("Upload " + session.id() + " is " + now.status().label());
        }
        quotaLedger.release(session.ownerId(), session.reservationId());
        abortQuietly(handle(session));
        if (session.status() == UploadStatus.COMPLETING) {
            deleteQuietly(session.location());
        }
        jdbi.useExtension(UploadChunkDao.class, dao -> dao.deleteAll(session.id()));
        log.infof("Upload %s aborted: %s", session.id(), reason);
    }

    private void recordFailure(UUID sessionId, DriveException e) {
        log.warnf("Upload %s failed while completing: %s", sessionId, e.getMessage());
        jdbi.useExtension(UploadSessionDao.class,
                dao -> dao.recordFailure(sessionId, e.kind() + ": " + e.getMessage(), clock.instant()));
    }

    private UploadSessionRecord requireSession(UUID sessionId) {
        return jdbi.withExtension(UploadSessionDao.class, dao -> dao.findById(sessionId))
                .orElseThrow(() -> DriveException.notFound("Upload session", sessionId));
    }

    private static MultipartHandle handle(UploadSessionRecord session) {
        return new MultipartHandle(session.multipartId(), session.location());
    }

    private void abortQuietly(MultipartHandle handle) {
        try {
            blobService.abortMultipart(handle);
        } catch (DriveException e) {
            log.warnf(e, "Failed to abort multipart %s; staged parts are orphaned", handle.uploadId());
        }
    }

    private void deleteQuietly(BlobLocation location) {
        try {
            blobService.delete(location);
        } catch (DriveException e) {
            log.warnf(e, "Failed to delete %s; object is orphaned", location);
        }
    }
}
