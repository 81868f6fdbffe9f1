package com.libragraph.drive.core.upload;

import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.error.ErrorKind;
import com.libragraph.drive.core.quota.QuotaSnapshot;
import com.libragraph.drive.core.storage.MultipartHandle;
import com.libragraph.drive.core.storage.PartTag;
import com.libragraph.drive.core.storage.StorageException;
import com.libragraph.drive.core.test.DriveFixture;
import com.libragraph.drive.core.test.ForwardingBlobStore;
import com.libragraph.drive.types.UploadStatus;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHasher;
import io.smallrye.mutiny.Uni;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadSessionManagerTest {

    static final byte[] CONTENT = "hello world!".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path blobRoot;

    DriveFixture fx;
    UploadSessionManager uploads;
    UUID owner;

    @BeforeEach
    void setUp() {
        fx = new DriveFixture(blobRoot);
        uploads = fx.uploads();
        owner = UUID.randomUUID();
    }

    @Test
    void initiate_reservesDeclaredSizeAndPlansChunks() {
        UploadSessionView view = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, "text/plain", 12));

        assertThat(view.status()).isEqualTo(UploadStatus.INITIATED);
        assertThat(view.chunkSize()).isEqualTo(DriveFixture.CHUNK_SIZE);
        assertThat(view.expectedChunks()).isEqualTo(3);
        assertThat(view.missingChunks()).containsExactly(1, 2, 3);
        assertThat(fx.quota().account(owner).reserved()).isEqualTo(12);
    }

    @Test
    void initiate_invalidArguments_areRejected() {
        assertThatThrownBy(() -> uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 2L << 20)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.initiate(UploadRequest.newFile(owner, "a/b", null, null, 10)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.initiate(
                UploadRequest.newFile(owner, "a.txt", null, null, 10).withChunkSize(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initiate_chunksBelowMinimum_onlyAllowedForSingleChunk() {
        assertThatThrownBy(() -> uploads.initiate(
                UploadRequest.newFile(owner, "a.txt", null, null, 12).withChunkSize(3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("below the minimum");
        assertThat(fx.quota().account(owner).reserved()).isZero();

        UploadSessionView single = uploads.initiate(
                UploadRequest.newFile(owner, "b.txt", null, null, 3).withChunkSize(3));

        assertThat(single.expectedChunks()).isEqualTo(1);
    }

    @Test
    void initiate_overQuota_failsWithoutSession() {
        fx.quota().openAccount(owner, 10);

        assertThatThrownBy(() -> uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)))
                .isInstanceOfSatisfying(DriveException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
                    assertThat(e.details()).containsEntry("limit", 10L).containsEntry("requested", 12L);
                });
        assertThat(fx.quota().account(owner).reserved()).isZero();
    }

    @Test
    void initiate_intoMissingFolder_isNotFound() {
        assertThatThrownBy(() -> uploads.initiate(
                UploadRequest.newFile(owner, "a.txt", UUID.randomUUID(), null, 12)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void chunks_inAnyOrder_completeOnLastChunk() {
        UploadSessionView view = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, "text/plain", 12)
                .withExpectedHash(ContentHasher.hash(CONTENT)));

        ChunkReceipt second = uploads.uploadChunk(view.sessionId(), 2, chunk(2));
        assertThat(uploads.status(view.sessionId()).status()).isEqualTo(UploadStatus.IN_PROGRESS);
        ChunkReceipt third = uploads.uploadChunk(view.sessionId(), 3, chunk(3));
        ChunkReceipt first = uploads.uploadChunk(view.sessionId(), 1, chunk(1));

        assertThat(second.completion()).isNull();
        assertThat(third.receivedChunks()).isEqualTo(2);
        assertThat(first.isLast()).isTrue();
        UploadResult result = first.completion();
        assertThat(result).isNotNull();
        assertThat(result.versionNumber()).isEqualTo(1);
        assertThat(result.sizeBytes()).isEqualTo(12);
        assertThat(result.contentHash()).isEqualTo(ContentHasher.hash(CONTENT));
        assertThat(result.deduplicated()).isFalse();
        assertThat(result.hasWarnings()).isFalse();

        assertThat(read(result.fileId())).isEqualTo(CONTENT);
        UploadSessionView done = uploads.status(view.sessionId());
        assertThat(done.status()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(done.resultFileId()).isEqualTo(result.fileId());
        assertThat(done.resultVersion()).isEqualTo(1);
        QuotaSnapshot acct = fx.quota().account(owner);
        assertThat(acct.used()).isEqualTo(12);
        assertThat(acct.reserved()).isZero();
    }

    @Test
    void complete_again_returnsRecordedResult() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        UploadResult first = uploadAll(sessionId).completion();

        UploadResult again = uploads.complete(sessionId);

        assertThat(again.fileId()).isEqualTo(first.fileId());
        assertThat(again.versionNumber()).isEqualTo(first.versionNumber());
        assertThat(again.contentHash()).isEqualTo(first.contentHash());
        assertThat(fx.versions().listVersions(first.fileId())).hasSize(1);
        assertThat(fx.quota().account(owner).used()).isEqualTo(12);
    }

    @Test
    void duplicateChunk_sameBytes_isAcceptedSilently() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));

        ChunkReceipt again = uploads.uploadChunk(sessionId, 1, chunk(1));

        assertThat(again.duplicate()).isTrue();
        assertThat(again.receivedChunks()).isEqualTo(1);
        assertThat(uploads.status(sessionId).receivedChunks()).containsExactly(1);
    }

    @Test
    void duplicateChunk_differentBytes_isConflict() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));

        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 1, "XXXX".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFLICT));
    }

    @Test
    void chunk_outOfRangeOrOversized_isRejected() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();

        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 0, chunk(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 4, chunk(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 1, "12345".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 1, new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void complete_withMissingChunk_isInvalidStateNamingTheGap() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));
        uploads.uploadChunk(sessionId, 3, chunk(3));

        assertThatThrownBy(() -> uploads.complete(sessionId))
                .isInstanceOfSatisfying(DriveException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STATE);
                    assertThat(e.details()).containsEntry("missing", List.of(2));
                });
        assertThat(uploads.status(sessionId).status()).isEqualTo(UploadStatus.IN_PROGRESS);
    }

    @Test
    void hashMismatch_abortsSessionAndReleasesQuota() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)
                .withExpectedHash(ContentHasher.hash("something else".getBytes(StandardCharsets.UTF_8))))
                .sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));
        uploads.uploadChunk(sessionId, 2, chunk(2));

        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 3, chunk(3)))
                .isInstanceOfSatisfying(DriveException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.INTEGRITY_FAILURE);
                    assertThat(e.details()).containsKeys("expectedHash", "actualHash");
                });

        assertThat(uploads.status(sessionId).status()).isEqualTo(UploadStatus.ABORTED);
        assertThat(fx.exists(sessionLocation(sessionId))).isFalse();
        QuotaSnapshot acct = fx.quota().account(owner);
        assertThat(acct.used()).isZero();
        assertThat(acct.reserved()).isZero();
    }

    @Test
    void shortLastChunk_isSizeMismatch() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));
        uploads.uploadChunk(sessionId, 2, chunk(2));

        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 3, "d".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOfSatisfying(DriveException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.INTEGRITY_FAILURE);
                    assertThat(e.details()).containsEntry("expectedSize", 12L).containsEntry("actualSize", 9L);
                });
        assertThat(uploads.status(sessionId).status()).isEqualTo(UploadStatus.ABORTED);
        assertThat(fx.quota().account(owner).reserved()).isZero();
    }

    @Test
    void abort_releasesReservationAndIsIdempotent() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));

        UploadSessionView aborted = uploads.abort(sessionId);
        UploadSessionView again = uploads.abort(sessionId);

        assertThat(aborted.status()).isEqualTo(UploadStatus.ABORTED);
        assertThat(aborted.receivedChunks()).isEmpty();
        assertThat(again.status()).isEqualTo(UploadStatus.ABORTED);
        assertThat(fx.quota().account(owner).reserved()).isZero();
        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 2, chunk(2)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STATE));
        assertThatThrownBy(() -> uploads.complete(sessionId))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STATE));
    }

    @Test
    void abort_afterCompletion_isInvalidState() {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploadAll(sessionId);

        assertThatThrownBy(() -> uploads.abort(sessionId))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STATE));
        assertThat(uploads.status(sessionId).status()).isEqualTo(UploadStatus.COMPLETED);
    }

    @Test
    void unknownSession_isNotFound() {
        assertThatThrownBy(() -> uploads.status(UUID.randomUUID()))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void updateUpload_createsNextVersion() {
        UploadResult initial = uploads.uploadDirect(DirectUploadRequest.newFile(owner, "a.txt", null, null,
                "old".getBytes(StandardCharsets.UTF_8)));

        UUID sessionId = uploads.initiate(UploadRequest.update(owner, initial.fileId(), null, 12)).sessionId();
        UploadResult next = uploadAll(sessionId).completion();

        assertThat(next.fileId()).isEqualTo(initial.fileId());
        assertThat(next.versionNumber()).isEqualTo(2);
        assertThat(read(initial.fileId())).isEqualTo(CONTENT);
        FileRecord current = fx.versions().current(initial.fileId());
        assertThat(current.name()).isEqualTo("a.txt");
        assertThat(fx.versions().listVersions(initial.fileId())).hasSize(2);
        assertThat(fx.quota().account(owner).used()).isEqualTo(3 + 12);
    }

    @Test
    void updateUpload_ofAnotherOwnersFile_isNotFound() {
        UploadResult initial = uploads.uploadDirect(DirectUploadRequest.newFile(owner, "a.txt", null, null, CONTENT));

        assertThatThrownBy(() -> uploads.initiate(UploadRequest.update(UUID.randomUUID(), initial.fileId(), null, 12)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void identicalContent_isDeduplicatedAndChargedOnce() {
        UploadResult first = uploads.uploadDirect(DirectUploadRequest.newFile(owner, "a.txt", null, null, CONTENT));
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "b.txt", null, null, 12)).sessionId();
        UploadResult second = uploadAll(sessionId).completion();

        assertThat(first.deduplicated()).isFalse();
        assertThat(second.deduplicated()).isTrue();
        assertThat(second.fileId()).isNotEqualTo(first.fileId());
        assertThat(fx.versions().current(second.fileId()).location())
                .isEqualTo(fx.versions().current(first.fileId()).location());
        assertThat(fx.exists(sessionLocation(sessionId))).isFalse();
        assertThat(fx.quota().account(owner).used()).isEqualTo(12);
        assertThat(read(second.fileId())).isEqualTo(CONTENT);
    }

    @Test
    void uploadDirect_hashMismatch_storesNothing() {
        DirectUploadRequest request = new DirectUploadRequest(owner, null, "a.txt", null, null, CONTENT,
                ContentHasher.hash("other".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> uploads.uploadDirect(request))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INTEGRITY_FAILURE));
        assertThat(fx.quota().account(owner).used()).isZero();
        assertThat(fx.directory().listChildren(owner, null).files()).isEmpty();
    }

    @Test
    void uploadDirect_overQuota_isRejected() {
        fx.quota().openAccount(owner, 5);

        assertThatThrownBy(() -> uploads.uploadDirect(DirectUploadRequest.newFile(owner, "a.txt", null, null, CONTENT)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED));
        assertThat(fx.quota().account(owner).reserved()).isZero();
    }

    @Test
    void concurrentDuplicateChunks_storeOnce() throws Exception {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChunkReceipt>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return uploads.uploadChunk(sessionId, 1, chunk(1));
                }));
            }
            start.countDown();
            int fresh = 0;
            for (Future<ChunkReceipt> f : futures) {
                if (!f.get(30, TimeUnit.SECONDS).duplicate()) {
                    fresh++;
                }
            }
            assertThat(fresh).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(uploads.status(sessionId).receivedChunks()).containsExactly(1);
    }

    @Test
    void parallelChunks_completeExactlyOnce() throws Exception {
        byte[] data = "0123456789abcdefghijklmn".getBytes(StandardCharsets.UTF_8);
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "p.bin", null, null, data.length))
                .sessionId();
        int chunks = data.length / 4;
        ExecutorService pool = Executors.newFixedThreadPool(chunks);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChunkReceipt>> futures = new ArrayList<>();
        try {
            for (int i = 1; i <= chunks; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return uploads.uploadChunk(sessionId, index,
                            Arrays.copyOfRange(data, (index - 1) * 4, index * 4));
                }));
            }
            start.countDown();
            for (Future<ChunkReceipt> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        UploadSessionView view = uploads.status(sessionId);
        assertThat(view.status()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(fx.versions().listVersions(view.resultFileId())).hasSize(1);
        assertThat(read(view.resultFileId())).isEqualTo(data);
        assertThat(fx.quota().account(owner).used()).isEqualTo(data.length);
    }

    @Test
    void lastChunksWrittenTogether_stillComplete() throws Exception {
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));
        // Hold each chunk insert open until the other one is written too.
        CyclicBarrier bothInserted = new CyclicBarrier(2);
        fx.jdbi().setSqlLogger(new SqlLogger() {
            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getRawSql().startsWith("INSERT INTO upload_chunk")) {
                    try {
                        bothInserted.await(10, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }
            }
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<ChunkReceipt> receipts = new ArrayList<>();
        try {
            Future<ChunkReceipt> second = pool.submit(() -> uploads.uploadChunk(sessionId, 2, chunk(2)));
            Future<ChunkReceipt> third = pool.submit(() -> uploads.uploadChunk(sessionId, 3, chunk(3)));
            receipts.add(second.get(30, TimeUnit.SECONDS));
            receipts.add(third.get(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertThat(receipts).anySatisfy(r -> assertThat(r.completion()).isNotNull());
        UploadSessionView view = uploads.status(sessionId);
        assertThat(view.status()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(read(view.resultFileId())).isEqualTo(CONTENT);
    }

    @Test
    void finalizeFailure_leavesSessionCompletingUntilAborted() {
        AtomicBoolean failFinalize = new AtomicBoolean(true);
        fx = new DriveFixture(blobRoot, store -> new ForwardingBlobStore(store) {
            @Override
            public Uni<Long> completeMultipart(MultipartHandle handle, List<PartTag> parts) {
                if (failFinalize.get()) {
                    return Uni.createFrom().failure(new StorageException("backend went away"));
                }
                return delegate.completeMultipart(handle, parts);
            }
        });
        uploads = fx.uploads();
        UUID sessionId = uploads.initiate(UploadRequest.newFile(owner, "a.txt", null, null, 12)).sessionId();
        uploads.uploadChunk(sessionId, 1, chunk(1));
        uploads.uploadChunk(sessionId, 2, chunk(2));

        assertThatThrownBy(() -> uploads.uploadChunk(sessionId, 3, chunk(3)))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE));
        UploadSessionView stuck = uploads.status(sessionId);
        assertThat(stuck.status()).isEqualTo(UploadStatus.COMPLETING);
        assertThat(stuck.failure()).contains("BACKEND_UNAVAILABLE");

        failFinalize.set(false);
        assertThatThrownBy(() -> uploads.complete(sessionId))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STATE));

        assertThat(uploads.abort(sessionId).status()).isEqualTo(UploadStatus.ABORTED);
        assertThat(fx.quota().account(owner).reserved()).isZero();
    }

    private ChunkReceipt uploadAll(UUID sessionId) {
        ChunkReceipt last = null;
        for (int i = 1; i <= 3; i++) {
            last = uploads.uploadChunk(sessionId, i, chunk(i));
        }
        return last;
    }

    private static byte[] chunk(int index) {
        return Arrays.copyOfRange(CONTENT, (index - 1) * 4, index * 4);
    }

    private BlobLocation sessionLocation(UUID sessionId) {
        return new BlobLocation(DriveFixture.BUCKET, "owners/" + owner + "/uploads/" + sessionId);
    }

    private byte[] read(UUID fileId) {
        try (InputStream in = fx.versions().openContent(fileId)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
