package com.libragraph.drive.core.upload;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * {@code drive.upload.*} settings plus the bucket uploads land in.
 */
@ApplicationScoped
public class UploadSettings {

    private final String bucket;
    private final long defaultChunkSize;
    private final long minChunkSize;
    private final long maxFileSize;
    private final Duration sessionTtl;
    private final Duration idleTimeout;
    private final Duration tombstoneRetention;

    @Inject
    public UploadSettings(@ConfigProperty(name = "drive.blob-store.bucket", defaultValue = "file-storage")
                          String bucket,
                          @ConfigProperty(name = "drive.upload.default-chunk-size", defaultValue = "5242880")
                          long defaultChunkSize,
                          @ConfigProperty(name = "drive.upload.min-chunk-size", defaultValue = "5242880")
                          long minChunkSize,
                          @ConfigProperty(name = "drive.upload.max-file-size", defaultValue = "5368709120")
                          long maxFileSize,
                          @ConfigProperty(name = "drive.upload.session-ttl", defaultValue = "24h")
                          Duration sessionTtl,
                          @ConfigProperty(name = "drive.upload.idle-timeout", defaultValue = "1h")
                          Duration idleTimeout,
                          @ConfigProperty(name = "drive.upload.tombstone-retention", defaultValue = "24h")
                          Duration tombstoneRetention) {
        this.bucket = bucket;
        this.defaultChunkSize = defaultChunkSize;
        this.minChunkSize = minChunkSize;
        this.maxFileSize = maxFileSize;
        this.sessionTtl = sessionTtl;
        this.idleTimeout = idleTimeout;
        this.tombstoneRetention = tombstoneRetention;
    }

    public String bucket() {
        return bucket;
    }

    public long defaultChunkSize() {
        return defaultChunkSize;
    }

    /** Smallest chunk a multi-chunk upload may use; S3 compose rejects smaller non-final sources. */
    public long minChunkSize() {
        return minChunkSize;
    }

    public long maxFileSize() {
        return maxFileSize;
    }

    public Duration sessionTtl() {
        return sessionTtl;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public Duration tombstoneRetention() {
        return tombstoneRetention;
    }
}
