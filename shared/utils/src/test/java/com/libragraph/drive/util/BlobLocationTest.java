package com.libragraph.drive.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BlobLocationTest {

    @Test
    void shouldRoundTripThroughString() {
        BlobLocation loc = new BlobLocation("file-storage", "owners/abc/uploads/123");

        assertThat(loc.toString()).isEqualTo("file-storage/owners/abc/uploads/123");
        assertThat(BlobLocation.parse(loc.toString())).isEqualTo(loc);
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThatIllegalArgumentException().isThrownBy(() -> BlobLocation.parse("nokey"));
        assertThatIllegalArgumentException().isThrownBy(() -> BlobLocation.parse("/key"));
        assertThatIllegalArgumentException().isThrownBy(() -> BlobLocation.parse("bucket/"));
        assertThatIllegalArgumentException().isThrownBy(() -> new BlobLocation("a/b", "k"));
        assertThatIllegalArgumentException().isThrownBy(() -> new BlobLocation("b", "/k"));
    }

    @Test
    void withKeyShouldKeepBucket() {
        BlobLocation loc = new BlobLocation("b", "one").withKey("two");

        assertThat(loc.bucket()).isEqualTo("b");
        assertThat(loc.key()).isEqualTo("two");
    }
}
