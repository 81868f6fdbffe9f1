package com.libragraph.drive.core.content;

import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.core.error.ErrorKind;
import com.libragraph.drive.core.storage.BlobService;
import com.libragraph.drive.core.storage.FilesystemBlobStore;
import com.libragraph.drive.util.BlobLocation;
import com.libragraph.drive.util.ContentHasher;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentAddresserTest {

    @TempDir
    Path root;

    BlobService blobService;
    ContentAddresser addresser;

    @BeforeEach
    void setUp() {
        blobService = new BlobService(new FilesystemBlobStore(root.toString(), Clock.systemUTC()),
                0, Duration.ofMillis(1), Duration.ofSeconds(5));
        addresser = new ContentAddresser(blobService);
    }

    @Test
    void digestOfStoredObject_matchesDigestOfBytes() {
        byte[] data = new byte[200_000];
        new Random(42).nextBytes(data);
        BlobLocation location = new BlobLocation("files", "big");
        blobService.putObject(location, data, null);

        ContentAddresser.Digest stored = addresser.digest(location);

        assertThat(stored.size()).isEqualTo(data.length);
        assertThat(stored.hash()).isEqualTo(ContentHasher.hash(data));
        assertThat(stored).isEqualTo(addresser.digest(data));
    }

    @Test
    void digest_missingObject_isNotFound() {
        assertThatThrownBy(() -> addresser.digest(new BlobLocation("files", "missing")))
                .isInstanceOfSatisfying(DriveException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void chunkTag_isSha256Hex() {
        byte[] chunk = "chunk".getBytes(StandardCharsets.UTF_8);

        assertThat(addresser.chunkTag(chunk)).isEqualTo(DigestUtils.sha256Hex(chunk)).hasSize(64);
        assertThat(addresser.chunkTag("chunk!".getBytes(StandardCharsets.UTF_8)))
                .isNotEqualTo(addresser.chunkTag(chunk));
    }

    @Test
    void digestOfEmptyContent_isWellDefined() {
        ContentAddresser.Digest digest = addresser.digest(new byte[0]);
        assertThat(digest.size()).isZero();
        assertThat(digest.hash().toHex()).isEqualTo(DigestUtils.sha256Hex(new byte[0]));
    }
}
