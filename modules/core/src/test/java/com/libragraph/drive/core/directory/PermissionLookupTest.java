package com.libragraph.drive.core.directory;

import com.libragraph.drive.core.dao.FolderRecord;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.error.ErrorKind;
import com.libragraph.drive.core.test.DriveFixture;
import com.libragraph.drive.core.version.NewFile;
import com.libragraph.drive.types.FilePermission;
import com.libragraph.drive.types.ResourceType;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionLookupTest {

    @TempDir
    Path blobRoot;

    DriveFixture fx;
    PermissionLookup permissions;
    UUID owner;
    UUID grantee;
    FolderRecord outer;
    FolderRecord inner;
    UUID file;

    @BeforeEach
    void setUp() {
        fx = new DriveFixture(blobRoot);
        permissions = fx.permissions();
        owner = UUID.randomUUID();
        grantee = UUID.randomUUID();
        outer = fx.directory().createFolder(owner, null, "Outer");
        inner = fx.directory().createFolder(owner, outer.id(), "Inner");
        byte[] data = "shared".getBytes(StandardCharsets.UTF_8);
        BlobLocation location = fx.put("staged/file", data);
        file = fx.versions().createInitialVersion(new NewFile(owner, "f.txt", inner.id(), null, location,
                ContentHasher.hash(data), data.length, null)).record().fileId();
    }

    @Test
    void owner_hasAdmin() {
        assertThat(permissions.effectivePermission(owner, ResourceType.FILE, file)).contains(FilePermission.ADMIN);
        assertThat(permissions.effectivePermission(owner, ResourceType.FOLDER, outer.id()))
                .contains(FilePermission.ADMIN);
    }

    @Test
    void stranger_hasNothing() {
        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).isEmpty();
        assertThat(permissions.hasPermission(grantee, ResourceType.FILE, file, FilePermission.READ)).isFalse();
    }

    @Test
    void grantOnAncestor_isInherited() {
        permissions.share(owner, ResourceType.FOLDER, outer.id(), grantee, FilePermission.WRITE);

        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).contains(FilePermission.WRITE);
        assertThat(permissions.effectivePermission(grantee, ResourceType.FOLDER, inner.id()))
                .contains(FilePermission.WRITE);
        assertThat(permissions.hasPermission(grantee, ResourceType.FILE, file, FilePermission.READ)).isTrue();
        assertThat(permissions.hasPermission(grantee, ResourceType.FILE, file, FilePermission.ADMIN)).isFalse();
    }

    @Test
    void strongestAncestorGrant_wins() {
        permissions.share(owner, ResourceType.FOLDER, outer.id(), grantee, FilePermission.READ);
        permissions.share(owner, ResourceType.FOLDER, inner.id(), grantee, FilePermission.ADMIN);

        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).contains(FilePermission.ADMIN);
    }

    @Test
    void directGrant_takesPrecedenceOverInherited() {
        permissions.share(owner, ResourceType.FOLDER, outer.id(), grantee, FilePermission.ADMIN);
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.READ);

        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).contains(FilePermission.READ);
    }

    @Test
    void share_replacesEarlierGrant() {
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.READ);
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.WRITE);

        assertThat(permissions.listShares(file)).hasSize(1);
        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).contains(FilePermission.WRITE);
    }

    @Test
    void unshare_revokes() {
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.READ);

        assertThat(permissions.unshare(owner, ResourceType.FILE, file, grantee)).isTrue();
        assertThat(permissions.unshare(owner, ResourceType.FILE, file, grantee)).isFalse();
        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).isEmpty();
    }

    @Test
    void unshare_byNonOwner_isNotFoundAndKeepsGrant() {
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.READ);

        assertThatThrownBy(() -> permissions.unshare(grantee, ResourceType.FILE, file, grantee))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).contains(FilePermission.READ);
    }

    @Test
    void share_byNonOwner_isNotFound() {
        assertThatThrownBy(() -> permissions.share(grantee, ResourceType.FILE, file, UUID.randomUUID(),
                FilePermission.READ))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void share_withOwner_isRejected() {
        assertThatThrownBy(() -> permissions.share(owner, ResourceType.FILE, file, owner, FilePermission.READ))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deletedResource_grantsNothing() {
        permissions.share(owner, ResourceType.FILE, file, grantee, FilePermission.READ);
        fx.versions().softDelete(file);

        assertThat(permissions.effectivePermission(grantee, ResourceType.FILE, file)).isEmpty();
        assertThat(permissions.effectivePermission(owner, ResourceType.FILE, file)).isEmpty();
    }
}
