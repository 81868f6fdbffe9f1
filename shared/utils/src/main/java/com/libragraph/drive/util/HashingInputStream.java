package com.libragraph.drive.util;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Feeds every byte read through a {@link ContentHasher}.
 *
 * <p>The digest is only meaningful once the wrapped stream has been read to EOF;
 * {@link #finish()} refuses to produce one earlier.
 */
public class HashingInputStream extends FilterInputStream {

    private final ContentHasher hasher;
    private boolean eof;

    public HashingInputStream(InputStream in) {
        this(in, new ContentHasher());
    }

    public HashingInputStream(InputStream in, ContentHasher hasher) {
        super(in);
        this.hasher = hasher;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b == -1) {
            eof = true;
        } else {
            hasher.update(new byte[]{(byte) b});
        }
        return b;
    }

    @Override
    public int read(byte[] buf, int off, int len) throws IOException {
        int n = super.read(buf, off, len);
        if (n == -1) {
            eof = true;
        } else if (n > 0) {
            hasher.update(buf, off, n);
        }
        return n;
    }

    @Override
    public long skip(long n) {
        throw new UnsupportedOperationException("Skipping would corrupt the content hash");
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    public long bytesRead() {
        return hasher.bytesHashed();
    }

    public ContentHash finish() {
        if (!eof) {
            hasher.abandon();
            throw new IllegalStateException("Stream not fully consumed after "
                    + hasher.bytesHashed() + " bytes");
        }
        return hasher.finish();
    }

    public void abandon() {
        hasher.abandon();
    }
}
