package com.libragraph.drive.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.security.MessageDigest;

/**
 * Incremental SHA-256 over an ordered byte stream.
 *
 * <p>Bytes must be fed in final object order. A hasher yields exactly one digest:
 * {@link #finish()} may be called once, and never after {@link #abandon()}.
 * An abandoned hasher represents an interrupted stream and its partial state is discarded.
 * Not thread-safe.
 */
public final class ContentHasher {

    private enum State { OPEN, FINISHED, ABANDONED }

    private final MessageDigest digest = DigestUtils.getSha256Digest();
    private long bytesHashed;
    private State state = State.OPEN;

    public ContentHasher update(byte[] data) {
        return update(data, 0, data.length);
    }

    public ContentHasher update(byte[] data, int offset, int length) {
        requireOpen();
        digest.update(data, offset, length);
        bytesHashed += length;
        return this;
    }

    public long bytesHashed() {
        return bytesHashed;
    }

    public ContentHash finish() {
        requireOpen();
        state = State.FINISHED;
        return new ContentHash(digest.digest());
    }

    /**
     * Marks the stream as interrupted. Any further use fails.
     */
    public void abandon() {
        if (state == State.OPEN) {
            digest.reset();
        }
        state = State.ABANDONED;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    private void requireOpen() {
        if (state == State.ABANDONED) {
            throw new IllegalStateException("Hasher was abandoned; partial digest is unusable");
        }
        if (state == State.FINISHED) {
            throw new IllegalStateException("Hasher already produced its digest");
        }
    }

    public static ContentHash hash(byte[] data) {
        return new ContentHash(DigestUtils.sha256(data));
    }
}
