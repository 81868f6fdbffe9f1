package com.libragraph.drive.core.event;

import com.libragraph.drive.core.dao.OutboxDao;
import com.libragraph.drive.core.test.DriveFixture;
import com.libragraph.drive.core.test.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class OutboxRelayTest {

    @TempDir
    Path blobRoot;

    DriveFixture fx;
    RecordingPublisher publisher;
    OutboxRelay relay;
    UUID owner;

    @BeforeEach
    void setUp() {
        fx = new DriveFixture(blobRoot);
        publisher = new RecordingPublisher();
        relay = new OutboxRelay(fx.jdbi(), fx.outbox(), publisher, fx.clock(), 2);
        owner = UUID.randomUUID();
    }

    @Test
    void relay_publishesInInsertionOrderAcrossBatches() {
        UUID[] fileIds = appendVersionEvents(5);

        assertThat(relay.relay()).isEqualTo(5);

        assertThat(publisher.events()).extracting(StorageEvent::fileId).containsExactly(fileIds);
        assertThat(publisher.events()).allSatisfy(e -> {
            assertThat(e.eventType()).isEqualTo(StorageEvent.VERSION_CREATED);
            assertThat(e.ownerId()).isEqualTo(owner);
            assertThat(e.versionNumber()).isEqualTo(1);
        });
        assertThat(relay.relay()).isZero();
        assertThat(pending()).isZero();
    }

    @Test
    void publishFailure_stopsThePassAndIsRetriedLater() {
        UUID[] fileIds = appendVersionEvents(3);
        publisher.failWith(new IllegalStateException("broker down"));

        assertThat(relay.relay()).isZero();
        assertThat(pending()).isEqualTo(3);
        assertThat(fx.jdbi().withExtension(OutboxDao.class, dao -> dao.findPending(1)).get(0).lastError())
                .contains("broker down");

        publisher.recover();
        assertThat(relay.relay()).isEqualTo(3);
        assertThat(publisher.events()).extracting(StorageEvent::fileId).containsExactly(fileIds);
    }

    @Test
    void rolledBackTransaction_leavesNoEvent() {
        try {
            fx.jdbi().useTransaction(h -> {
                fx.outbox().append(h, StorageEvent.fileDeleted(owner, UUID.randomUUID(), fx.clock().instant()));
                throw new IllegalStateException("roll back");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("roll back");
        }

        assertThat(relay.relay()).isZero();
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    void dedupKey_identifiesTheChange() {
        UUID fileId = UUID.randomUUID();
        UUID folderId = UUID.randomUUID();
        var at = fx.clock().instant();

        assertThat(StorageEvent.versionCreated(owner, fileId, 3, 10, "ab", at).dedupKey()).isEqualTo(fileId + ":3");
        assertThat(StorageEvent.fileDeleted(owner, fileId, at).dedupKey()).isEqualTo(fileId + ":deleted");
        assertThat(StorageEvent.folderDeleted(owner, folderId, at).dedupKey()).isEqualTo(folderId + ":deleted");
    }

    @Test
    void payload_roundTripsThroughJson() {
        StorageEvent event = StorageEvent.versionCreated(owner, UUID.randomUUID(), 2, 42, "cafe",
                fx.clock().instant());

        String json = fx.outbox().serialize(event);

        assertThat(json).contains("\"eventType\":\"version.created\"").doesNotContain("folderId");
        assertThat(fx.outbox().deserialize(json)).isEqualTo(event);
    }

    private UUID[] appendVersionEvents(int count) {
        UUID[] ids = new UUID[count];
        for (int i = 0; i < count; i++) {
            UUID fileId = UUID.randomUUID();
            ids[i] = fileId;
            fx.jdbi().useTransaction(h -> fx.outbox().append(h,
                    StorageEvent.versionCreated(owner, fileId, 1, 10, "ab", fx.clock().instant())));
        }
        return ids;
    }

    private int pending() {
        return fx.jdbi().withExtension(OutboxDao.class, OutboxDao::countPending);
    }
}
