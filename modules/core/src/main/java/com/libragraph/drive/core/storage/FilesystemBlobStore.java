package com.libragraph.drive.core.storage;

import com.libragraph.drive.util.BlobLocation;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.digest.DigestUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Filesystem-backed BlobStore for development and testing.
 *
 * <p>Layout: objects at {@code {root}/{bucket}/{key}}, in-flight multipart uploads under
 * {@code {root}/.multipart/{uploadId}/{partNumber}}. Part tags are MD5 hex digests.
 * Presigned URLs are {@code file:} URIs with an {@code expires} query parameter.
 */
@ApplicationScoped
@IfBuildProperty(name = "drive.blob-store.type", stringValue = "filesystem")
public class FilesystemBlobStore implements BlobStore {

    private static final String MULTIPART_DIR = ".multipart";

    private final Path root;
    private final Clock clock;

    @Inject
    public FilesystemBlobStore(@ConfigProperty(name = "drive.blob-store.filesystem.root") String root,
                               Clock clock) {
        this.root = Path.of(root);
        this.clock = clock;
    }

    private Path resolve(BlobLocation location) {
        Path path = root.resolve(location.bucket()).resolve(location.key()).normalize();
        if (!path.startsWith(root.resolve(location.bucket()))) {
            throw new StorageException("Key escapes bucket: " + location);
        }
        return path;
    }

    private Path stagingDir(MultipartHandle handle) {
        return root.resolve(MULTIPART_DIR).resolve(handle.uploadId());
    }

    @Override
    public Uni<MultipartHandle> initiateMultipart(BlobLocation target) {
        return Uni.createFrom().item(() -> {
            MultipartHandle handle = new MultipartHandle(UUID.randomUUID().toString(), target);
            try {
                Files.createDirectories(stagingDir(handle));
            } catch (IOException e) {
                throw new StorageException("Failed to initiate multipart upload: " + target, e);
            }
            return handle;
        });
    }

    @Override
    public Uni<PartTag> uploadPart(MultipartHandle handle, int partNumber, byte[] data) {
        return Uni.createFrom().item(() -> {
            Path dir = stagingDir(handle);
            if (!Files.isDirectory(dir)) {
                throw new StorageException("No such multipart upload: " + handle.uploadId());
            }
            Path part = dir.resolve(Integer.toString(partNumber));
            Path tmp = dir.resolve(partNumber + "." + UUID.randomUUID() + ".tmp");
            try {
                Files.write(tmp, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                Files.move(tmp, part, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StorageException("Failed to upload part " + partNumber + " of " + handle.uploadId(), e);
            }
            return new PartTag(partNumber, DigestUtils.md5Hex(data), data.length);
        });
    }

    @Override
    public Uni<Long> completeMultipart(MultipartHandle handle, List<PartTag> parts) {
        return Uni.createFrom().item(() -> {
            Path dir = stagingDir(handle);
            if (!Files.isDirectory(dir)) {
                throw new StorageException("No such multipart upload: " + handle.uploadId());
            }
            Path target = resolve(handle.target());
            long total = 0;
            try {
                Files.createDirectories(target.getParent());
                Path assembling = target.resolveSibling(target.getFileName() + "." + handle.uploadId() + ".tmp");
                try (OutputStream out = Files.newOutputStream(assembling)) {
                    for (PartTag tag : parts) {
                        Path part = dir.resolve(Integer.toString(tag.partNumber()));
                        if (!Files.exists(part)) {
                            throw new StorageException("Missing part " + tag.partNumber()
                                    + " of " + handle.uploadId());
                        }
                        String actual;
                        try (InputStream in = Files.newInputStream(part)) {
                            actual = DigestUtils.md5Hex(in);
                        }
                        if (!actual.equals(tag.tag())) {
                            throw new StorageException("Part " + tag.partNumber() + " tag mismatch: expected "
                                    + tag.tag() + ", found " + actual);
                        }
                        total += Files.copy(part, out);
                    }
                } catch (StorageException e) {
                    Files.deleteIfExists(assembling);
                    throw e;
                }
                Files.move(assembling, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                deleteRecursively(dir);
            } catch (IOException e) {
                throw new StorageException("Failed to complete multipart upload " + handle.uploadId(), e);
            }
            return total;
        });
    }

    @Override
    public Uni<Void> abortMultipart(MultipartHandle handle) {
        return Uni.createFrom().voidItem().invoke(() -> {
            try {
                deleteRecursively(stagingDir(handle));
            } catch (IOException e) {
                throw new StorageException("Failed to abort multipart upload " + handle.uploadId(), e);
            }
        });
    }

    @Override
    public Uni<String> putObject(BlobLocation location, byte[] data, String contentType) {
        return Uni.createFrom().item(() -> {
            Path path = resolve(location);
            try {
                Files.createDirectories(path.getParent());
                Path tmp = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
                Files.write(tmp, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StorageException("Failed to write blob: " + location, e);
            }
            return DigestUtils.md5Hex(data);
        });
    }

    @Override
    public Uni<InputStream> getObject(BlobLocation location) {
        return Uni.createFrom().item(() -> {
            Path path = resolve(location);
            try {
                return Files.newInputStream(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(location);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + location, e);
            }
        });
    }

    @Override
    public Uni<Void> copyObject(BlobLocation source, BlobLocation target) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path src = resolve(source);
            Path dst = resolve(target);
            if (!Files.exists(src)) {
                throw new BlobNotFoundException(source);
            }
            try {
                Files.createDirectories(dst.getParent());
                Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StorageException("Failed to copy " + source + " to " + target, e);
            }
        });
    }

    @Override
    public Uni<Void> deleteObject(BlobLocation location) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolve(location);
            try {
                if (Files.deleteIfExists(path)) {
                    pruneEmptyParents(path.getParent(), root.resolve(location.bucket()));
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + location, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(BlobLocation location) {
        return Uni.createFrom().item(() -> Files.exists(resolve(location)));
    }

    @Override
    public Uni<URI> presignUpload(BlobLocation location, Duration ttl) {
        return presign(location, ttl);
    }

    @Override
    public Uni<URI> presignDownload(BlobLocation location, Duration ttl) {
        return presign(location, ttl);
    }

    private Uni<URI> presign(BlobLocation location, Duration ttl) {
        return Uni.createFrom().item(() -> {
            long expires = clock.instant().plus(ttl).getEpochSecond();
            return URI.create(resolve(location).toUri() + "?expires=" + expires);
        });
    }

    @Override
    public Uni<Void> ping(String bucket) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path dir = root.resolve(bucket);
            try {
                Files.createDirectories(dir);
            } catch (FileAlreadyExistsException e) {
                throw new StorageException("Bucket path is not a directory: " + dir, e);
            } catch (IOException e) {
                throw new StorageException("Blob root not writable: " + dir, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop) && current.startsWith(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException | NoSuchFileException e) {
                // a concurrent writer got there first
                break;
            }
            current = current.getParent();
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
