package com.libragraph.drive.core.directory;

import com.libragraph.drive.core.dao.DeletionBatchDao;
import com.libragraph.drive.core.dao.DeletionBatchRecord;
import com.libragraph.drive.core.dao.DeletionItemRecord;
import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.dao.FileRecordDao;
import com.libragraph.drive.core.dao.FolderDao;
import com.libragraph.drive.core.dao.FolderRecord;
import com.libragraph.drive.core.db.Constraints;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.event.EventOutbox;
import com.libragraph.drive.core.event.StorageEvent;
import com.libragraph.drive.core.version.VersionStore;
import com.libragraph.drive.types.ResourceType;
import com.libragraph.drive.util.KeyedLocks;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Folder hierarchy of each owner.
 *
 * <p>Folders carry a materialized path so a subtree can be read with one prefix query.
 * Structural changes for one owner are serialized; a move rewrites the paths of the whole
 * subtree in the same transaction as the move itself.
 */
@ApplicationScoped
public class FileDirectory {

    private static final Logger log = Logger.getLogger(FileDirectory.class);

    private final Jdbi jdbi;
    private final VersionStore versionStore;
    private final EventOutbox outbox;
    private final Clock clock;
    private final int deleteBatchSize;
    private final KeyedLocks<UUID> ownerLocks = new KeyedLocks<>();

    @Inject
    public FileDirectory(Jdbi jdbi,
                         VersionStore versionStore,
                         EventOutbox outbox,
                         Clock clock,
                         @ConfigProperty(name = "drive.directory.delete-batch-size", defaultValue = "500")
                         int deleteBatchSize) {
        this.jdbi = jdbi;
        this.versionStore = versionStore;
        this.outbox = outbox;
        this.clock = clock;
        this.deleteBatchSize = deleteBatchSize;
    }

    /**
     * @param parentId null for a top-level folder
     * @throws DriveException NOT_FOUND if the parent is missing or deleted,
     *                        CONFLICT if an active sibling has the same name
     */
    public FolderRecord createFolder(UUID ownerId, UUID parentId, String name) {
        validateName(name);
        return ownerLocks.withLock(ownerId, () -> uniqueNames(() -> jdbi.inTransaction(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FolderRecord parent = parentId == null ? null : requireActive(folders, ownerId, parentId);
            requireFreeName(folders, ownerId, parentId, name);
            Instant now = clock.instant();
            FolderRecord folder = new FolderRecord(UUID.randomUUID(), ownerId, name, parentId,
                    childPath(parent, name), null, null, now, now, null);
            folders.insert(folder);
            log.debugf("Created folder %s at %s for %s", folder.id(), folder.path(), ownerId);
            return folder;
        })));
    }

    /**
     * Moves a folder, with its whole subtree, under a new parent.
     *
     * @param newParentId null to move to the top level
     * @throws DriveException INVALID_STATE if the target is the folder itself or one of its
     *                        descendants
     */
    public FolderRecord moveFolder(UUID ownerId, UUID folderId, UUID newParentId) {
        return ownerLocks.withLock(ownerId, () -> uniqueNames(() -> jdbi.inTransaction(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FolderRecord folder = requireActive(folders, ownerId, folderId);
            if (Objects.equals(folder.parentId(), newParentId)) {
                return folder;
            }
            FolderRecord parent = null;
            if (newParentId != null) {
                parent = requireActive(folders, ownerId, newParentId);
                if (parent.id().equals(folderId) || parent.path().startsWith(folder.path() + "/")) {
                    throw DriveException.invalidState("Cannot move folder " + folder.path()
                            + " into its own subtree " + parent.path());
                }
            }
            requireFreeName(folders, ownerId, newParentId, folder.name());
            return relocate(folders, folder, newParentId, folder.name(), childPath(parent, folder.name()));
        })));
    }

    public FolderRecord renameFolder(UUID ownerId, UUID folderId, String newName) {
        validateName(newName);
        return ownerLocks.withLock(ownerId, () -> uniqueNames(() -> jdbi.inTransaction(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FolderRecord folder = requireActive(folders, ownerId, folderId);
            if (folder.name().equals(newName)) {
                return folder;
            }
            requireFreeName(folders, ownerId, folder.parentId(), newName);
            String parentPath = folder.parentPath();
            return relocate(folders, folder, folder.parentId(), newName, parentPath + "/" + newName);
        })));
    }

    public FolderRecord updateAppearance(UUID ownerId, UUID folderId, String color, String icon) {
        return jdbi.inTransaction(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            requireActive(folders, ownerId, folderId);
            folders.updateAppearance(folderId, color, icon, clock.instant());
            return folders.findById(folderId).orElseThrow();
        });
    }

    /**
     * Soft-deletes a folder, every descendant folder and every file inside them.
     *
     * <p>The full set of ids is persisted as a deletion batch first, then applied in chunks of
     * {@code drive.directory.delete-batch-size}. A crash mid-way leaves an incomplete batch
     * that {@link #resumePendingDeletions()} finishes. Before the batch is marked complete the
     * subtree is scanned again, so anything created or moved under it in the meantime goes too.
     * All items share one deletion timestamp.
     */
    public DeletionReport softDeleteFolder(UUID ownerId, UUID folderId) {
        DeletionReport planned = ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FolderRecord root = requireActive(folders, ownerId, folderId);
            List<UUID> folderIds = new ArrayList<>();
            folderIds.add(root.id());
            for (FolderRecord descendant : folders.listByPathPrefix(ownerId,
                    Constraints.likePrefix(root.path() + "/"))) {
                folderIds.add(descendant.id());
            }
            List<FileRecord> files = h.attach(FileRecordDao.class).listInFolders(ownerId, folderIds);

            Instant now = clock.instant();
            UUID batchId = UUID.randomUUID();
            List<DeletionItemRecord> items = new ArrayList<>(folderIds.size() + files.size());
            int seq = 0;
            for (UUID id : folderIds) {
                items.add(new DeletionItemRecord(batchId, seq++, ResourceType.FOLDER, id, false));
            }
            for (FileRecord file : files) {
                items.add(new DeletionItemRecord(batchId, seq++, ResourceType.FILE, file.fileId(), false));
            }
            DeletionBatchDao batches = h.attach(DeletionBatchDao.class);
            batches.insert(new DeletionBatchRecord(batchId, ownerId, folderId, now, now, null));
            batches.insertItems(items);
            log.infof("Planned deletion %s of %s: %d folders, %d files",
                    batchId, root.path(), folderIds.size(), files.size());
            return new DeletionReport(batchId, folderIds.size(), files.size(), false);
        }));
        boolean complete = applyBatch(planned.batchId());
        return new DeletionReport(planned.batchId(), planned.folders(), planned.files(), complete);
    }

    /**
     * Finishes deletion batches left incomplete by a crash.
     *
     * @return number of batches completed
     */
    public int resumePendingDeletions() {
        List<DeletionBatchRecord> pending = jdbi.withExtension(DeletionBatchDao.class,
                DeletionBatchDao::findIncomplete);
        int completed = 0;
        for (DeletionBatchRecord batch : pending) {
            log.infof("Resuming deletion batch %s (owner %s)", batch.id(), batch.ownerId());
            if (applyBatch(batch.id())) {
                completed++;
            }
        }
        return completed;
    }

    /**
     * Applies pending items chunk by chunk, each chunk in its own transaction.
     *
     * @return true once the batch is marked complete
     */
    boolean applyBatch(UUID batchId) {
        DeletionBatchRecord batch = jdbi.withExtension(DeletionBatchDao.class, dao -> dao.findById(batchId))
                .orElseThrow(() -> DriveException.notFound("Deletion batch", batchId));
        while (true) {
            Boolean drained = jdbi.inTransaction(h -> {
                DeletionBatchDao batches = h.attach(DeletionBatchDao.class);
                if (batches.findById(batchId).orElseThrow().completedAt() != null) {
                    return null;
                }
                List<DeletionItemRecord> items = batches.findPendingItems(batchId, deleteBatchSize);
                if (items.isEmpty()) {
                    return true;
                }
                applyItems(h, batch, items);
                return false;
            });
            if (drained == null) {
                return true;
            }
            if (drained && ownerLocks.withLock(batch.ownerId(),
                    () -> jdbi.inTransaction(h -> sweepOrComplete(h, batch)))) {
                return true;
            }
        }
    }

    /**
     * Picks up folders and files that entered the subtree after the batch was planned, or marks
     * the batch complete when there are none. Runs under the owner lock so nothing can be added
     * between the last scan and completion.
     *
     * @return true once the batch is complete
     */
    private boolean sweepOrComplete(Handle h, DeletionBatchRecord batch) {
        DeletionBatchDao batches = h.attach(DeletionBatchDao.class);
        if (batches.findById(batch.id()).orElseThrow().completedAt() != null) {
            return true;
        }
        if (!batches.findPendingItems(batch.id(), 1).isEmpty()) {
            return false;
        }
        FolderDao folders = h.attach(FolderDao.class);
        FolderRecord root = folders.findById(batch.rootFolderId())
                .orElseThrow(() -> DriveException.notFound("Folder", batch.rootFolderId()));
        // A deleted path can be reused by a new folder, so only folders hanging off the batch count.
        Set<UUID> scope = new LinkedHashSet<>(batches.listFolderIds(batch.id()));
        List<FolderRecord> candidates = new ArrayList<>(folders.listByPathPrefix(batch.ownerId(),
                Constraints.likePrefix(root.path() + "/")));
        List<UUID> lateFolders = new ArrayList<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Iterator<FolderRecord> it = candidates.iterator(); it.hasNext(); ) {
                FolderRecord folder = it.next();
                if (scope.contains(folder.parentId())) {
                    scope.add(folder.id());
                    lateFolders.add(folder.id());
                    it.remove();
                    grew = true;
                }
            }
        }
        List<FileRecord> lateFiles = h.attach(FileRecordDao.class).listInFolders(batch.ownerId(),
                new ArrayList<>(scope));
        if (lateFolders.isEmpty() && lateFiles.isEmpty()) {
            batches.complete(batch.id(), clock.instant());
            log.infof("Deletion batch %s complete", batch.id());
            return true;
        }

        int seq = batches.countItems(batch.id());
        List<DeletionItemRecord> items = new ArrayList<>(lateFolders.size() + lateFiles.size());
        for (UUID id : lateFolders) {
            items.add(new DeletionItemRecord(batch.id(), seq++, ResourceType.FOLDER, id, false));
        }
        for (FileRecord file : lateFiles) {
            items.add(new DeletionItemRecord(batch.id(), seq++, ResourceType.FILE, file.fileId(), false));
        }
        batches.insertItems(items);
        log.infof("Deletion batch %s: %d folders and %d files joined %s after planning",
                batch.id(), lateFolders.size(), lateFiles.size(), root.path());
        return false;
    }

    private void applyItems(Handle h, DeletionBatchRecord batch, List<DeletionItemRecord> items) {
        List<UUID> folderIds = new ArrayList<>();
        List<UUID> fileIds = new ArrayList<>();
        List<Integer> seqs = new ArrayList<>(items.size());
        for (DeletionItemRecord item : items) {
            (item.resourceType() == ResourceType.FOLDER ? folderIds : fileIds).add(item.resourceId());
            seqs.add(item.seq());
        }
        Instant at = batch.deletedAt();
        if (!folderIds.isEmpty()) {
            h.attach(FolderDao.class).softDelete(folderIds, at);
            for (UUID id : folderIds) {
                outbox.append(h, StorageEvent.folderDeleted(batch.ownerId(), id, at));
            }
        }
        if (!fileIds.isEmpty()) {
            h.attach(FileRecordDao.class).softDelete(fileIds, at);
            for (UUID id : fileIds) {
                outbox.append(h, StorageEvent.fileDeleted(batch.ownerId(), id, at));
            }
        }
        h.attach(DeletionBatchDao.class).markApplied(batch.id(), seqs);
        log.debugf("Deletion batch %s: applied %d items", batch.id(), items.size());
    }

    /**
     * @param folderId null for the owner's root
     */
    public DirectoryListing listChildren(UUID ownerId, UUID folderId) {
        return jdbi.withHandle(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FileRecordDao files = h.attach(FileRecordDao.class);
            if (folderId == null) {
                return new DirectoryListing(null, folders.listRoot(ownerId), files.listInRoot(ownerId));
            }
            requireActive(folders, ownerId, folderId);
            return new DirectoryListing(folderId, folders.listChildren(ownerId, folderId),
                    files.listInFolder(ownerId, folderId));
        });
    }

    /** All active descendants of a folder, ordered by path. The folder itself is excluded. */
    public List<FolderRecord> listSubtree(UUID ownerId, UUID folderId) {
        return jdbi.withHandle(h -> {
            FolderDao folders = h.attach(FolderDao.class);
            FolderRecord root = requireActive(folders, ownerId, folderId);
            return folders.listByPathPrefix(ownerId, Constraints.likePrefix(root.path() + "/"));
        });
    }

    public FolderRecord requireActiveFolder(UUID ownerId, UUID folderId) {
        return jdbi.withExtension(FolderDao.class, dao -> requireActive(dao, ownerId, folderId));
    }

    /**
     * @param folderId null to move the file to the owner's root
     */
    public FileRecord moveFile(UUID ownerId, UUID fileId, UUID folderId) {
        FileRecord file = requireOwnedFile(ownerId, fileId);
        if (folderId != null) {
            requireActiveFolder(ownerId, folderId);
        }
        return versionStore.relocate(fileId, folderId, file.name());
    }

    public FileRecord renameFile(UUID ownerId, UUID fileId, String newName) {
        validateName(newName);
        FileRecord file = requireOwnedFile(ownerId, fileId);
        return versionStore.relocate(fileId, file.folderId(), newName);
    }

    private FileRecord requireOwnedFile(UUID ownerId, UUID fileId) {
        FileRecord file = versionStore.current(fileId);
        if (!file.ownerId().equals(ownerId)) {
            throw DriveException.notFound("File", fileId);
        }
        return file;
    }

    private FolderRecord relocate(FolderDao folders, FolderRecord folder, UUID parentId,
                                  String name, String newPath) {
        Instant now = clock.instant();
        String oldPath = folder.path();
        int rewritten = folders.rewritePathPrefix(folder.ownerId(), Constraints.likePrefix(oldPath + "/"),
                newPath, oldPath.length() + 1, now);
        folders.relocate(folder.id(), parentId, name, newPath, now);
        log.infof("Folder %s: %s -> %s (%d descendants)", folder.id(), oldPath, newPath, rewritten);
        return folders.findById(folder.id()).orElseThrow();
    }

    private static FolderRecord requireActive(FolderDao folders, UUID ownerId, UUID folderId) {
        return folders.findActive(ownerId, folderId)
                .orElseThrow(() -> DriveException.notFound("Folder", folderId));
    }

    private static void requireFreeName(FolderDao folders, UUID ownerId, UUID parentId, String name) {
        boolean taken = parentId == null
                ? folders.findActiveRootChild(ownerId, name).isPresent()
                : folders.findActiveChild(ownerId, parentId, name).isPresent();
        if (taken) {
            throw DriveException.conflict("A folder named '" + name + "' already exists here");
        }
    }

    private static String childPath(FolderRecord parent, String name) {
        return (parent == null ? "" : parent.path()) + "/" + name;
    }

    /** Sibling-name races lost across processes surface as unique violations. */
    private static <T> T uniqueNames(Supplier<T> action) {
        try {
            return action.get();
        } catch (JdbiException e) {
            if (Constraints.isUniqueViolation(e)) {
                throw DriveException.conflict("A folder with this name already exists here", e);
            }
            throw e;
        }
    }

    public static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be blank");
        }
        if (name.contains("/")) {
            throw new IllegalArgumentException("Name must not contain '/': " + name);
        }
        if (name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Reserved name: " + name);
        }
    }
}
