package com.libragraph.drive.core.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.libragraph.drive.core.content.ContentAddresser;
import com.libragraph.drive.core.directory.FileDirectory;
import com.libragraph.drive.core.directory.PermissionLookup;
import com.libragraph.drive.core.event.EventOutbox;
import com.libragraph.drive.core.event.OutboxRelay;
import com.libragraph.drive.core.metadata.MetadataCodec;
import com.libragraph.drive.core.quota.QuotaLedger;
import com.libragraph.drive.core.storage.BlobService;
import com.libragraph.drive.core.storage.BlobStore;
import com.libragraph.drive.core.storage.FilesystemBlobStore;
import com.libragraph.drive.core.upload.UploadSessionManager;
import com.libragraph.drive.core.upload.UploadSettings;
import com.libragraph.drive.core.version.BlobRegistry;
import com.libragraph.drive.core.version.VersionStore;
import com.libragraph.drive.util.BlobLocation;
import org.jdbi.v3.core.Jdbi;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * The whole engine wired by hand over H2 and a filesystem blob store.
 */
public final class DriveFixture {

    public static final String BUCKET = "file-storage";
    public static final long DEFAULT_QUOTA = 1L << 30;
    public static final long CHUNK_SIZE = 4;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private final Jdbi jdbi;
    private final Path blobRoot;
    private final BlobStore blobStore;
    private final BlobService blobService;
    private final ContentAddresser addresser;
    private final QuotaLedger quota;
    private final EventOutbox outbox;
    private final MetadataCodec metadataCodec;
    private final VersionStore versions;
    private final FileDirectory directory;
    private final PermissionLookup permissions;
    private final UploadSettings uploadSettings;
    private final UploadSessionManager uploads;
    private final RecordingPublisher publisher = new RecordingPublisher();
    private final OutboxRelay relay;

    public DriveFixture(Path blobRoot) {
        this(blobRoot, UnaryOperator.identity());
    }

    /**
     * @param decorate wraps the filesystem store, e.g. to inject failures
     */
    public DriveFixture(Path blobRoot, UnaryOperator<BlobStore> decorate) {
        this.blobRoot = blobRoot;
        this.jdbi = TestDatabase.create(objectMapper);
        this.blobStore = decorate.apply(new FilesystemBlobStore(blobRoot.toString(), clock));
        this.blobService = new BlobService(blobStore, 2, Duration.ofMillis(1), Duration.ofSeconds(10));
        this.addresser = new ContentAddresser(blobService);
        this.quota = new QuotaLedger(jdbi, clock, DEFAULT_QUOTA);
        this.outbox = new EventOutbox(objectMapper, clock);
        this.metadataCodec = new MetadataCodec(objectMapper);
        this.versions = new VersionStore(jdbi, blobService, new BlobRegistry(), outbox, quota,
                metadataCodec, clock, Duration.ofMinutes(15));
        this.directory = new FileDirectory(jdbi, versions, outbox, clock, 3);
        this.permissions = new PermissionLookup(jdbi, clock);
        this.uploadSettings = new UploadSettings(BUCKET, CHUNK_SIZE, CHUNK_SIZE, 1 << 20,
                Duration.ofHours(24), Duration.ofHours(1), Duration.ofHours(24));
        this.uploads = new UploadSessionManager(jdbi, blobService, addresser, versions, directory,
                quota, clock, uploadSettings);
        this.relay = new OutboxRelay(jdbi, outbox, publisher, clock, 100);
    }

    public MutableClock clock() { return clock; }
    public ObjectMapper objectMapper() { return objectMapper; }
    public Jdbi jdbi() { return jdbi; }
    public Path blobRoot() { return blobRoot; }
    public BlobService blobService() { return blobService; }
    public ContentAddresser addresser() { return addresser; }
    public QuotaLedger quota() { return quota; }
    public EventOutbox outbox() { return outbox; }
    public MetadataCodec metadataCodec() { return metadataCodec; }
    public VersionStore versions() { return versions; }
    public FileDirectory directory() { return directory; }
    public PermissionLookup permissions() { return permissions; }
    public UploadSessionManager uploads() { return uploads; }
    public RecordingPublisher publisher() { return publisher; }
    public OutboxRelay relay() { return relay; }

    /** Stores {@code data} directly in the blob store, bypassing the engine. */
    public BlobLocation put(String key, byte[] data) {
        BlobLocation location = new BlobLocation(BUCKET, key);
        blobService.putObject(location, data, "application/octet-stream");
        return location;
    }

    public boolean exists(BlobLocation location) {
        return blobService.exists(location);
    }
}
