package com.libragraph.drive.core.content;

import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.storage.BlobService;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHash;
import com.libragraph.drive.util.ContentHasher;
import com.libragraph.drive.util.HashingInputStream;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.digest.DigestUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Computes content hashes for deduplication and integrity checks.
 *
 * <p>Whole-object digests are always taken over the finalized, correctly ordered object,
 * never assembled from per-chunk digests. Chunk tags only detect resent chunks.
 */
@ApplicationScoped
public class ContentAddresser {

    private static final Logger log = Logger.getLogger(ContentAddresser.class);

    private final BlobService blobService;

    @Inject
    public ContentAddresser(BlobService blobService) {
        this.blobService = blobService;
    }

    public record Digest(ContentHash hash, long size) {}

    /**
     * Streams the stored object through a fresh hasher.
     *
     * @throws DriveException BACKEND_UNAVAILABLE if the stream breaks; no digest is produced
     */
    public Digest digest(BlobLocation location) {
        HashingInputStream in = new HashingInputStream(blobService.openStream(location));
        try (in) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            in.abandon();
            log.warnf("Hashing of %s interrupted after %d bytes", location, in.bytesRead());
            throw DriveException.backendUnavailable("Interrupted while hashing " + location, e);
        }
        long size = in.bytesRead();
        ContentHash hash = in.finish();
        log.debugf("Digest %s: %s (%d bytes)", location, hash, size);
        return new Digest(hash, size);
    }

    public Digest digest(byte[] data) {
        return new Digest(ContentHasher.hash(data), data.length);
    }

    /**
     * Tag identifying the bytes of one chunk. Two uploads of the same chunk index are
     * duplicates exactly when their tags match.
     */
    public String chunkTag(byte[] data) {
        return DigestUtils.sha256Hex(data);
    }
}
