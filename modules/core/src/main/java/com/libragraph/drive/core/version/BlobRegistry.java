package com.libragraph.drive.core.version;

import com.libragraph.drive.core.dao.BlobObjectDao;
import com.libragraph.drive.core.dao.BlobObjectRecord;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import org.jdbi.v3.core.Handle;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-owner deduplication and reference counting of physical content.
 *
 * <p>One {@code blob_object} row exists per (owner, content hash); its {@code ref_count}
 * is the number of version records pointing at it. All methods run inside the caller's
 * transaction and lock the rows they touch.
 */
@ApplicationScoped
public class BlobRegistry {

    private static final Logger log = Logger.getLogger(BlobRegistry.class);

    public record Registration(BlobObjectRecord blob, boolean deduplicated) {}

    /**
     * References existing content with this hash, or registers {@code uploaded} as new content.
     */
    public Registration register(Handle handle, UUID ownerId, ContentHash hash,
                                 BlobLocation uploaded, long size, Instant now) {
        BlobObjectDao dao = handle.attach(BlobObjectDao.class);
        Optional<BlobObjectRecord> existing = dao.findForUpdate(ownerId, hash);
        if (existing.isPresent()) {
            BlobObjectRecord blob = existing.get();
            dao.adjustRefCount(blob.id(), 1);
            log.debugf("Dedup hit: owner=%s hash=%s blob=%s", ownerId, hash, blob.id());
            return new Registration(blob, true);
        }
        BlobObjectRecord blob = new BlobObjectRecord(UUID.randomUUID(), ownerId, hash,
                uploaded.bucket(), uploaded.key(), size, 1, now);
        dao.insert(blob);
        log.debugf("New blob: owner=%s hash=%s blob=%s at %s", ownerId, hash, blob.id(), uploaded);
        return new Registration(blob, false);
    }

    public void addReference(Handle handle, UUID blobId) {
        BlobObjectDao dao = handle.attach(BlobObjectDao.class);
        dao.findByIdForUpdate(blobId)
                .orElseThrow(() -> new IllegalStateException("Dangling blob reference: " + blobId));
        dao.adjustRefCount(blobId, 1);
    }

    /**
     * Drops one reference.
     *
     * @return the blob if this was its last reference; its row is already gone and the
     *         caller deletes the object once the transaction commits
     */
    public Optional<BlobObjectRecord> dropReference(Handle handle, UUID blobId) {
        BlobObjectDao dao = handle.attach(BlobObjectDao.class);
        BlobObjectRecord blob = dao.findByIdForUpdate(blobId)
                .orElseThrow(() -> new IllegalStateException("Dangling blob reference: " + blobId));
        dao.adjustRefCount(blobId, -1);
        if (blob.refCount() <= 1 && dao.deleteUnreferenced(blobId) == 1) {
            log.debugf("Blob %s unreferenced, scheduled for deletion", blobId);
            return Optional.of(blob);
        }
        return Optional.empty();
    }
}
