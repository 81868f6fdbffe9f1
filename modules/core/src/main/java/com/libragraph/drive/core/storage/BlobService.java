package com.libragraph.drive.core.storage;

import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.util.BlobLocation;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Blocking facade over {@link BlobStore} used by the engine.
 *
 * <p>Idempotent calls (part upload, reads, copy, delete, presign) are retried with exponential
 * backoff on {@link StorageException}. Non-idempotent calls ({@link #completeMultipart},
 * {@link #putObject}) are attempted once. Failures surface as {@link DriveException}:
 * missing objects as NOT_FOUND, everything else as BACKEND_UNAVAILABLE.
 */
@ApplicationScoped
public class BlobService {

    private static final Logger log = Logger.getLogger(BlobService.class);

    private final BlobStore store;
    private final int retryAttempts;
    private final Duration initialBackoff;
    private final Duration timeout;

    @Inject
    public BlobService(BlobStore store,
                       @ConfigProperty(name = "drive.blob-store.retry.attempts", defaultValue = "3")
                       int retryAttempts,
                       @ConfigProperty(name = "drive.blob-store.retry.initial-backoff", defaultValue = "100ms")
                       Duration initialBackoff,
                       @ConfigProperty(name = "drive.blob-store.timeout", defaultValue = "60s")
                       Duration timeout) {
        this.store = store;
        this.retryAttempts = retryAttempts;
        this.initialBackoff = initialBackoff;
        this.timeout = timeout;
    }

    public MultipartHandle initiateMultipart(BlobLocation target) {
        return idempotent(store.initiateMultipart(target), "initiate multipart " + target);
    }

    public PartTag uploadPart(MultipartHandle handle, int partNumber, byte[] data) {
        return idempotent(store.uploadPart(handle, partNumber, data),
                "upload part " + partNumber + " of " + handle.uploadId());
    }

    public long completeMultipart(MultipartHandle handle, List<PartTag> parts) {
        return once(store.completeMultipart(handle, parts), "complete multipart " + handle.uploadId());
    }

    public void abortMultipart(MultipartHandle handle) {
        idempotent(store.abortMultipart(handle), "abort multipart " + handle.uploadId());
    }

    public String putObject(BlobLocation location, byte[] data, String contentType) {
        return once(store.putObject(location, data, contentType), "put " + location);
    }

    public InputStream openStream(BlobLocation location) {
        return idempotent(store.getObject(location), "read " + location);
    }

    public void copy(BlobLocation source, BlobLocation target) {
        idempotent(store.copyObject(source, target), "copy " + source + " to " + target);
    }

    public void delete(BlobLocation location) {
        idempotent(store.deleteObject(location), "delete " + location);
    }

    public boolean exists(BlobLocation location) {
        return idempotent(store.exists(location), "stat " + location);
    }

    public URI presignUpload(BlobLocation location, Duration ttl) {
        return idempotent(store.presignUpload(location, ttl), "presign upload " + location);
    }

    public URI presignDownload(BlobLocation location, Duration ttl) {
        return idempotent(store.presignDownload(location, ttl), "presign download " + location);
    }

    public void ping(String bucket) {
        once(store.ping(bucket), "ping " + bucket);
    }

    private <T> T idempotent(Uni<T> op, String what) {
        Uni<T> withRetry = retryAttempts <= 0
                ? op
                : op.onFailure(StorageException.class)
                    .invoke(e -> log.debugf("Retrying %s after: %s", what, e.getMessage()))
                    .onFailure(StorageException.class)
                    .retry().withBackOff(initialBackoff, initialBackoff.multipliedBy(32))
                    .atMost(retryAttempts);
        return await(withRetry, what);
    }

    private <T> T once(Uni<T> op, String what) {
        return await(op, what);
    }

    private <T> T await(Uni<T> op, String what) {
        try {
            return op.await().atMost(timeout);
        } catch (BlobNotFoundException e) {
            throw DriveException.notFound("Blob", e.location());
        } catch (StorageException e) {
            log.warnf("Blob store failure during %s: %s", what, e.getMessage());
            throw DriveException.backendUnavailable("Blob store failed to " + what, e);
        } catch (TimeoutException e) {
            log.warnf("Blob store timed out during %s after %s", what, timeout);
            throw DriveException.backendUnavailable("Blob store timed out: " + what, e);
        }
    }
}
