package com.libragraph.drive.core.storage;

import com.libragraph.drive.util.BlobLocation;
import io.smallrye.mutiny.Uni;

import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Contract over an external object store.
 *
 * <p>Implementations are selected at build time by {@code drive.blob-store.type}.
 * Every operation is lazy: nothing happens until the returned {@link Uni} is subscribed.
 */
public interface BlobStore {

    /**
     * Allocates a multipart upload that will materialize at {@code target}.
     */
    Uni<MultipartHandle> initiateMultipart(BlobLocation target);

    /**
     * Uploads one part. Re-uploading the same part number replaces the previous bytes.
     *
     * @param partNumber 1-based
     */
    Uni<PartTag> uploadPart(MultipartHandle handle, int partNumber, byte[] data);

    /**
     * Assembles the parts, in the given order, into the target object. Not idempotent.
     *
     * @return final object size in bytes
     * @throws StorageException if a part is missing or its tag does not match
     */
    Uni<Long> completeMultipart(MultipartHandle handle, List<PartTag> parts);

    /**
     * Discards uploaded parts. Succeeds if the upload is already gone.
     */
    Uni<Void> abortMultipart(MultipartHandle handle);

    /**
     * Single-shot write for small objects.
     *
     * @return the object's etag
     */
    Uni<String> putObject(BlobLocation location, byte[] data, String contentType);

    /**
     * Opens the object for streaming. The caller closes the stream.
     *
     * @throws BlobNotFoundException if the object does not exist
     */
    Uni<InputStream> getObject(BlobLocation location);

    Uni<Void> copyObject(BlobLocation source, BlobLocation target);

    /**
     * Deletes the object. Succeeds if it does not exist.
     */
    Uni<Void> deleteObject(BlobLocation location);

    Uni<Boolean> exists(BlobLocation location);

    Uni<URI> presignUpload(BlobLocation location, Duration ttl);

    Uni<URI> presignDownload(BlobLocation location, Duration ttl);

    /**
     * Lightweight reachability check for health checks.
     */
    Uni<Void> ping(String bucket);
}
