package com.quickshare.upload.client.source;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Upload source over an in-memory byte array.
 *
 * <p>
 * The array is not copied; callers must not modify it while an upload runs.
 */
public class ByteArrayUploadSource implements UploadSource {

    private final String name;
    private final byte[] content;

    public ByteArrayUploadSource(String name, byte[] content) {
        this.name = name;
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getSize() {
        return content.length;
    }

    @Override
    public ChunkReader open() {
        return new ChunkReader() {
            @Override
            public byte[] read(long offset, int length) throws IOException {
                if (offset < 0 || offset + length > content.length) {
                    throw new IOException("Range [" + offset + ", " + (offset + length) + ") outside of "
                            + content.length + " bytes");
                }
                return Arrays.copyOfRange(content, (int) offset, (int) offset + length);
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }
}
