package com.libragraph.drive.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    private static final String EMPTY_SHA256 =
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @Test
    void shouldDefensiveCopyOnConstructionAndAccess() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0x01;
        ContentHash hash = new ContentHash(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);

        hash.bytes()[0] = (byte) 0x7F;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectNullBytes() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentHash(null));
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[16]))
                .withMessageContaining("32 bytes");
    }

    @Test
    void shouldParseHexOfEitherCase() {
        ContentHash lower = ContentHash.fromHex(EMPTY_SHA256);
        ContentHash upper = ContentHash.fromHex(EMPTY_SHA256.toUpperCase());

        assertThat(upper).isEqualTo(lower);
        assertThat(upper.toHex()).isEqualTo(EMPTY_SHA256);
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("abcd"))
                .withMessageContaining("64 characters");
    }

    @Test
    void shouldRejectInvalidHexCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("z".repeat(64)));
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.fromHex(EMPTY_SHA256);
        ContentHash b = ContentHash.fromHex(EMPTY_SHA256);
        ContentHash c = ContentHash.fromHex("0".repeat(64));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toString()).isEqualTo(EMPTY_SHA256);
    }
}
