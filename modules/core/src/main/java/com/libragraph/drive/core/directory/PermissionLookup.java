package com.libragraph.drive.core.directory;

import com.libragraph.drive.core.dao.FileRecordDao;
import com.libragraph.drive.core.dao.FolderDao;
import com.libragraph.drive.core.dao.FolderRecord;
import com.libragraph.drive.core.dao.ShareDao;
import com.libragraph.drive.core.dao.ShareRecord;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.types.FilePermission;
import com.libragraph.drive.types.ResourceType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves what a principal may do with a file or folder.
 *
 * <p>Owners always hold ADMIN. Anyone else gets the direct grant on the resource if there is
 * one, otherwise the strongest grant on any ancestor folder.
 */
@ApplicationScoped
public class PermissionLookup {

    private static final Logger log = Logger.getLogger(PermissionLookup.class);

    private final Jdbi jdbi;
    private final Clock clock;

    @Inject
    public PermissionLookup(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    /**
     * Grants {@code permission} on an owned resource, replacing any earlier grant to the same grantee.
     */
    public ShareRecord share(UUID ownerId, ResourceType type, UUID resourceId,
                             UUID granteeId, FilePermission permission) {
        if (ownerId.equals(granteeId)) {
            throw new IllegalArgumentException("Cannot share a resource with its owner");
        }
        return jdbi.inTransaction(h -> {
            requireOwned(h, ownerId, type, resourceId);
            ShareDao shares = h.attach(ShareDao.class);
            shares.delete(resourceId, granteeId);
            ShareRecord share = new ShareRecord(resourceId, type, granteeId, permission, ownerId, clock.instant());
            shares.insert(share);
            log.infof("Shared %s %s with %s as %s", type.label(), resourceId, granteeId, permission);
            return share;
        });
    }

    /**
     * @return true if a grant was removed
     * @throws DriveException NOT_FOUND if the resource is missing or not owned by {@code ownerId}
     */
    public boolean unshare(UUID ownerId, ResourceType type, UUID resourceId, UUID granteeId) {
        return jdbi.inTransaction(h -> {
            requireOwned(h, ownerId, type, resourceId);
            boolean removed = h.attach(ShareDao.class).delete(resourceId, granteeId) > 0;
            if (removed) {
                log.infof("Revoked %s %s from %s", type.label(), resourceId, granteeId);
            }
            return removed;
        });
    }

    public List<ShareRecord> listShares(UUID resourceId) {
        return jdbi.withExtension(ShareDao.class, dao -> dao.listForResource(resourceId));
    }

    /**
     * @return empty if the principal has no access or the resource does not exist
     */
    public Optional<FilePermission> effectivePermission(UUID principalId, ResourceType type, UUID resourceId) {
        return jdbi.withHandle(h -> {
            Optional<Resource> maybe = resolve(h, type, resourceId);
            if (maybe.isEmpty()) {
                return Optional.<FilePermission>empty();
            }
            Resource resource = maybe.get();
            if (resource.ownerId().equals(principalId)) {
                return Optional.of(FilePermission.ADMIN);
            }
            ShareDao shares = h.attach(ShareDao.class);
            Optional<ShareRecord> direct = shares.find(resourceId, principalId);
            if (direct.isPresent()) {
                return Optional.of(direct.get().permission());
            }
            List<UUID> ancestors = ancestors(h.attach(FolderDao.class), resource.parentFolderId());
            if (ancestors.isEmpty()) {
                return Optional.<FilePermission>empty();
            }
            FilePermission strongest = null;
            for (ShareRecord share : shares.findForGrantee(principalId, ancestors)) {
                strongest = FilePermission.strongest(strongest, share.permission());
            }
            return Optional.ofNullable(strongest);
        });
    }

    public boolean hasPermission(UUID principalId, ResourceType type, UUID resourceId, FilePermission required) {
        return effectivePermission(principalId, type, resourceId)
                .map(p -> p.implies(required))
                .orElse(false);
    }

    private List<UUID> ancestors(FolderDao folders, UUID folderId) {
        List<UUID> chain = new ArrayList<>();
        UUID next = folderId;
        while (next != null) {
            Optional<FolderRecord> folder = folders.findById(next);
            if (folder.isEmpty() || !folder.get().isActive()) {
                break;
            }
            chain.add(next);
            next = folder.get().parentId();
        }
        return chain;
    }

    private Optional<Resource> resolve(Handle h, ResourceType type, UUID resourceId) {
        if (type == ResourceType.FILE) {
            return h.attach(FileRecordDao.class).findCurrent(resourceId)
                    .map(f -> new Resource(f.ownerId(), f.folderId()));
        }
        return h.attach(FolderDao.class).findById(resourceId)
                .filter(FolderRecord::isActive)
                .map(f -> new Resource(f.ownerId(), f.parentId()));
    }

    private void requireOwned(Handle h, UUID ownerId, ResourceType type, UUID resourceId) {
        Resource resource = resolve(h, type, resourceId)
                .orElseThrow(() -> DriveException.notFound(label(type), resourceId));
        if (!resource.ownerId().equals(ownerId)) {
            throw DriveException.notFound(label(type), resourceId);
        }
    }

    private static String label(ResourceType type) {
        return type == ResourceType.FILE ? "File" : "Folder";
    }

    /** @param parentFolderId folder containing the resource; null at the owner's root */
    private record Resource(UUID ownerId, UUID parentFolderId) {}
}
