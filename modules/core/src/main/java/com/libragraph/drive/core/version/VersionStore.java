package com.libragraph.drive.core.version;

import com.libragraph.drive.core.dao.BlobObjectRecord;
import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.dao.FileRecordDao;
import com.libragraph.drive.core.dao.FileVersionDao;
import com.libragraph.drive.core.dao.FileVersionRecord;
import com.libragraph.drive.core.db.Constraints;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.event.EventOutbox;
import com.libragraph.drive.core.event.StorageEvent;
import com.libragraph.drive.core.metadata.ContentMetadata;
import com.libragraph.drive.core.metadata.MetadataCodec;
import com.libragraph.drive.core.quota.QuotaLedger;
import com.libragraph.drive.core.storage.BlobService;
import com.libragraph.drive.types.ProcessingStatus;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import com.libragraph.drive.util.KeyedLocks;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Version history of files.
 *
 * <p>A file is a lineage of {@code file_record} rows sharing one {@code file_id}; exactly one
 * active row is current. Every version also has an immutable {@code file_version} snapshot.
 * Writers for one file are serialized in-process and by the current row's lock, so version
 * numbers are gapless and two concurrent writers can never both become current.
 */
@ApplicationScoped
public class VersionStore {

    private static final Logger log = Logger.getLogger(VersionStore.class);

    static final int MAX_ATTEMPTS = 3;

    private final Jdbi jdbi;
    private final BlobService blobService;
    private final BlobRegistry blobRegistry;
    private final EventOutbox outbox;
    private final QuotaLedger quotaLedger;
    private final MetadataCodec metadataCodec;
    private final Clock clock;
    private final Duration presignTtl;
    private final KeyedLocks<UUID> fileLocks = new KeyedLocks<>();

    @Inject
    public VersionStore(Jdbi jdbi,
                        BlobService blobService,
                        BlobRegistry blobRegistry,
                        EventOutbox outbox,
                        QuotaLedger quotaLedger,
                        MetadataCodec metadataCodec,
                        Clock clock,
                        @ConfigProperty(name = "drive.upload.presign-ttl", defaultValue = "15m")
                        Duration presignTtl) {
        this.jdbi = jdbi;
        this.blobService = blobService;
        this.blobRegistry = blobRegistry;
        this.outbox = outbox;
        this.quotaLedger = quotaLedger;
        this.metadataCodec = metadataCodec;
        this.clock = clock;
        this.presignTtl = presignTtl;
    }

    /**
     * Records version 1 of a new file.
     *
     * @throws DriveException CONFLICT if a file was already recorded for the same upload key
     */
    public VersionOutcome createInitialVersion(NewFile file) {
        UUID fileId = UUID.randomUUID();
        VersionOutcome outcome = fileLocks.withLock(fileId, () -> inTransactionWithRetry(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            requireUnusedUploadKey(files, file.uploadKey());
            Instant now = clock.instant();
            BlobRegistry.Registration reg = blobRegistry.register(h, file.ownerId(), file.hash(),
                    file.location(), file.sizeBytes(), now);
            BlobObjectRecord blob = reg.blob();

            FileRecord record = new FileRecord(UUID.randomUUID(), fileId, file.ownerId(), file.name(),
                    file.folderId(), blob.bucket(), blob.storageKey(), file.uploadKey(), blob.id(),
                    file.sizeBytes(), file.contentType(), file.hash(), 1, true, null,
                    ProcessingStatus.PENDING, null, null, now, now, null, null);
            files.insert(record);
            FileVersionRecord version = snapshot(record, "Initial version", file.ownerId(), null);
            h.attach(FileVersionDao.class).insert(version);
            outbox.append(h, StorageEvent.versionCreated(file.ownerId(), fileId, 1,
                    file.sizeBytes(), file.hash().toHex(), now));
            return new VersionOutcome(record, version, reg.deduplicated());
        }));
        log.infof("Created file %s (%s) for %s: %d bytes%s", fileId, file.name(), file.ownerId(),
                file.sizeBytes(), outcome.deduplicated() ? ", deduplicated" : "");
        discardRedundantUpload(outcome, file.location());
        return outcome;
    }

    public VersionOutcome createNextVersion(UUID fileId, BlobLocation location, ContentHash hash,
                                            long size, String description, UUID actor) {
        return createNextVersion(new NextVersion(fileId, location, hash, size, description, actor, null, null));
    }

    /**
     * Makes new content the current version of an existing file. The previous current row is
     * retired; its snapshot stays in the version history.
     *
     * @throws DriveException NOT_FOUND if the file has no active current version,
     *                        CONFLICT if another writer replaced it concurrently
     */
    public VersionOutcome createNextVersion(NextVersion next) {
        VersionOutcome outcome = fileLocks.withLock(next.fileId(), () -> inTransactionWithRetry(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            FileVersionDao versions = h.attach(FileVersionDao.class);
            FileRecord current = files.findCurrentForUpdate(next.fileId())
                    .orElseThrow(() -> DriveException.notFound("File", next.fileId()));
            requireUnusedUploadKey(files, next.uploadKey());
            Instant now = clock.instant();
            BlobRegistry.Registration reg = blobRegistry.register(h, current.ownerId(), next.hash(),
                    next.location(), next.sizeBytes(), now);
            BlobObjectRecord blob = reg.blob();

            int number = versions.maxVersion(next.fileId()) + 1;
            retire(files, current, now);
            FileRecord record = new FileRecord(UUID.randomUUID(), next.fileId(), current.ownerId(),
                    current.name(), current.folderId(), blob.bucket(), blob.storageKey(), next.uploadKey(),
                    blob.id(), next.sizeBytes(),
                    next.contentType() != null ? next.contentType() : current.contentType(),
                    next.hash(), number, true, current.id(), ProcessingStatus.PENDING, null, null,
                    now, now, null, null);
            files.insert(record);
            FileVersionRecord version = snapshot(record, next.description(), next.actor(), null);
            versions.insert(version);
            outbox.append(h, StorageEvent.versionCreated(current.ownerId(), next.fileId(), number,
                    next.sizeBytes(), next.hash().toHex(), now));
            return new VersionOutcome(record, version, reg.deduplicated());
        }));
        log.infof("File %s now at version %d%s", next.fileId(), outcome.record().versionNumber(),
                outcome.deduplicated() ? " (deduplicated)" : "");
        discardRedundantUpload(outcome, next.location());
        return outcome;
    }

    /**
     * Makes the content of an earlier version current again, as a new version. History is
     * never rewritten: the source version only gets its restore timestamp set.
     */
    public VersionOutcome restoreVersion(UUID fileId, int versionNumber, UUID actor) {
        VersionOutcome outcome = fileLocks.withLock(fileId, () -> inTransactionWithRetry(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            FileVersionDao versions = h.attach(FileVersionDao.class);
            FileRecord current = files.findCurrentForUpdate(fileId)
                    .orElseThrow(() -> DriveException.notFound("File", fileId));
            FileVersionRecord source = versions.find(fileId, versionNumber)
                    .orElseThrow(() -> DriveException.notFound("Version", fileId + "@" + versionNumber));
            Instant now = clock.instant();
            blobRegistry.addReference(h, source.blobId());

            int number = versions.maxVersion(fileId) + 1;
            retire(files, current, now);
            FileRecord record = new FileRecord(UUID.randomUUID(), fileId, current.ownerId(),
                    current.name(), current.folderId(), source.bucket(), source.storageKey(), null,
                    source.blobId(), source.sizeBytes(), current.contentType(), source.contentHash(),
                    number, true, current.id(), ProcessingStatus.PENDING, null, null,
                    now, now, null, null);
            files.insert(record);
            FileVersionRecord version = snapshot(record, "Restored from version " + versionNumber,
                    actor, versionNumber);
            versions.insert(version);
            versions.markRestored(source.id(), now);
            outbox.append(h, StorageEvent.versionCreated(current.ownerId(), fileId, number,
                    source.sizeBytes(), source.contentHash().toHex(), now));
            return new VersionOutcome(record, version, true);
        }));
        log.infof("File %s restored from version %d as version %d", fileId, versionNumber,
                outcome.record().versionNumber());
        return outcome;
    }

    /**
     * Deletes historical versions the policy does not keep. The current version, and any
     * version sharing content with a kept one, always survive. Blobs left without references
     * are deleted and their bytes returned to the owner's quota.
     */
    public PruneResult pruneOldVersions(UUID fileId, RetentionPolicy policy) {
        if (!policy.countRuleEnabled() && !policy.ageRuleEnabled()) {
            return PruneResult.empty();
        }
        List<BlobObjectRecord> freed = new ArrayList<>();
        List<Integer> deleted = new ArrayList<>();
        UUID ownerId = fileLocks.withLock(fileId, () -> jdbi.inTransaction(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            FileVersionDao versions = h.attach(FileVersionDao.class);
            FileRecord current = files.findCurrentForUpdate(fileId)
                    .orElseThrow(() -> DriveException.notFound("File", fileId));

            List<FileVersionRecord> all = new ArrayList<>(versions.listByFile(fileId));
            all.sort(Comparator.comparingInt(FileVersionRecord::versionNumber).reversed());
            Instant cutoff = policy.ageRuleEnabled() ? clock.instant().minus(policy.maxAge()) : null;

            Set<ContentHash> keptContent = new HashSet<>();
            List<FileVersionRecord> candidates = new ArrayList<>();
            for (int i = 0; i < all.size(); i++) {
                FileVersionRecord v = all.get(i);
                boolean keep = v.versionNumber() == current.versionNumber()
                        || (policy.countRuleEnabled() && i < policy.keepLast())
                        || (cutoff != null && !v.createdAt().isBefore(cutoff));
                if (keep) {
                    keptContent.add(v.contentHash());
                } else {
                    candidates.add(v);
                }
            }
            List<FileVersionRecord> doomed = candidates.stream()
                    .filter(v -> !keptContent.contains(v.contentHash()))
                    .toList();
            if (doomed.isEmpty()) {
                return current.ownerId();
            }

            List<Integer> numbers = doomed.stream().map(FileVersionRecord::versionNumber).sorted().toList();
            versions.delete(doomed.stream().map(FileVersionRecord::id).toList());
            files.deleteHistory(fileId, numbers);
            for (FileVersionRecord v : doomed) {
                blobRegistry.dropReference(h, v.blobId()).ifPresent(freed::add);
            }
            deleted.addAll(numbers);
            return current.ownerId();
        }));
        if (deleted.isEmpty()) {
            return PruneResult.empty();
        }

        long reclaimed = 0;
        List<BlobLocation> locations = new ArrayList<>();
        for (BlobObjectRecord blob : freed) {
            deleteQuietly(blob.location());
            locations.add(blob.location());
            reclaimed += blob.sizeBytes();
        }
        if (reclaimed > 0) {
            quotaLedger.reclaim(ownerId, reclaimed);
        }
        log.infof("Pruned versions %s of file %s, reclaimed %d bytes", deleted, fileId, reclaimed);
        return new PruneResult(List.copyOf(deleted), List.copyOf(locations), reclaimed);
    }

    public FileRecord current(UUID fileId) {
        return jdbi.withExtension(FileRecordDao.class, dao -> dao.findCurrent(fileId))
                .orElseThrow(() -> DriveException.notFound("File", fileId));
    }

    /**
     * Version history, oldest first.
     *
     * @throws DriveException NOT_FOUND if the file is absent or soft-deleted
     */
    public List<FileVersionRecord> listVersions(UUID fileId) {
        return jdbi.withHandle(h -> {
            requireLive(h, fileId);
            return h.attach(FileVersionDao.class).listByFile(fileId);
        });
    }

    /**
     * @throws DriveException NOT_FOUND if the file is absent or soft-deleted, or has no such version
     */
    public FileVersionRecord version(UUID fileId, int versionNumber) {
        return jdbi.withHandle(h -> {
            requireLive(h, fileId);
            return h.attach(FileVersionDao.class).find(fileId, versionNumber)
                    .orElseThrow(() -> DriveException.notFound("Version", fileId + "@" + versionNumber));
        });
    }

    private static void requireLive(Handle h, UUID fileId) {
        if (h.attach(FileRecordDao.class).findCurrent(fileId).isEmpty()) {
            throw DriveException.notFound("File", fileId);
        }
    }

    /**
     * Streams the current content. The caller closes the stream.
     */
    public InputStream openContent(UUID fileId) {
        FileRecord current = current(fileId);
        InputStream in = blobService.openStream(current.location());
        jdbi.useExtension(FileRecordDao.class, dao -> dao.touch(current.id(), clock.instant()));
        return in;
    }

    public InputStream openVersionContent(UUID fileId, int versionNumber) {
        return blobService.openStream(version(fileId, versionNumber).location());
    }

    public URI presignDownload(UUID fileId) {
        FileRecord current = current(fileId);
        URI uri = blobService.presignDownload(current.location(), presignTtl);
        jdbi.useExtension(FileRecordDao.class, dao -> dao.touch(current.id(), clock.instant()));
        return uri;
    }

    /**
     * Records the outcome of content processing on the current version.
     */
    public FileRecord updateProcessing(UUID fileId, ProcessingStatus status,
                                       ContentMetadata metadata, String thumbnailKey) {
        String encoded = metadataCodec.encode(metadata);
        return fileLocks.withLock(fileId, () -> jdbi.inTransaction(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            FileRecord current = files.findCurrentForUpdate(fileId)
                    .orElseThrow(() -> DriveException.notFound("File", fileId));
            files.updateProcessing(current.id(), status, encoded, thumbnailKey, clock.instant());
            log.debugf("File %s v%d processing %s", fileId, current.versionNumber(), status);
            return files.findCurrent(fileId).orElseThrow();
        }));
    }

    public ContentMetadata metadata(UUID fileId) {
        return metadataCodec.decode(current(fileId).metadata());
    }

    /**
     * Moves or renames every row of the lineage. Folder existence and sibling names are
     * checked by the caller.
     */
    public FileRecord relocate(UUID fileId, UUID folderId, String name) {
        return fileLocks.withLock(fileId, () -> jdbi.inTransaction(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            files.findCurrentForUpdate(fileId)
                    .orElseThrow(() -> DriveException.notFound("File", fileId));
            files.relocate(fileId, folderId, name, clock.instant());
            return files.findCurrent(fileId).orElseThrow();
        }));
    }

    /**
     * Soft-deletes the whole lineage. Blobs stay referenced so the file can be recovered
     * until it is purged.
     */
    public void softDelete(UUID fileId) {
        fileLocks.withLock(fileId, () -> jdbi.useTransaction(h -> {
            FileRecordDao files = h.attach(FileRecordDao.class);
            FileRecord current = files.findCurrentForUpdate(fileId)
                    .orElseThrow(() -> DriveException.notFound("File", fileId));
            Instant now = clock.instant();
            files.softDelete(List.of(fileId), now);
            outbox.append(h, StorageEvent.fileDeleted(current.ownerId(), fileId, now));
        }));
        log.infof("Soft-deleted file %s", fileId);
    }

    private static void requireUnusedUploadKey(FileRecordDao files, String uploadKey) {
        if (uploadKey != null && files.findByUploadKey(uploadKey).isPresent()) {
            throw DriveException.conflict("A file was already recorded for upload " + uploadKey);
        }
    }

    private static void retire(FileRecordDao files, FileRecord current, Instant now) {
        if (files.retire(current.id(), now) == 0) {
            throw DriveException.conflict("File " + current.fileId() + " was modified concurrently");
        }
    }

    private static FileVersionRecord snapshot(FileRecord record, String description, UUID actor,
                                              Integer restoredFrom) {
        return new FileVersionRecord(UUID.randomUUID(), record.fileId(), record.versionNumber(),
                record.bucket(), record.storageKey(), record.blobId(), record.sizeBytes(),
                record.contentHash(), description, actor, record.createdAt(), null, restoredFrom);
    }

    /**
     * Runs {@code callback} in a transaction, retrying when a concurrent insert of the same
     * owner/hash blob row wins the race.
     */
    private <T> T inTransactionWithRetry(HandleCallback<T, RuntimeException> callback) {
        for (int attempt = 1; ; attempt++) {
            try {
                return jdbi.inTransaction(callback);
            } catch (JdbiException e) {
                if (!Constraints.isUniqueViolation(e)) {
                    throw e;
                }
                if (attempt >= MAX_ATTEMPTS) {
                    throw DriveException.conflict("Concurrent write did not settle after "
                            + attempt + " attempts", e);
                }
                log.debugf("Unique violation on attempt %d, retrying", attempt);
            }
        }
    }

    private void discardRedundantUpload(VersionOutcome outcome, BlobLocation uploaded) {
        if (outcome.deduplicated() && !outcome.record().location().equals(uploaded)) {
            deleteQuietly(uploaded);
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
