package com.quickshare.upload.client.source;

import java.io.Closeable;
import java.io.IOException;

/**
 * Random-access reader handing out chunk contents.
 */
public interface ChunkReader extends Closeable {

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     *
     * @throws IOException if the range cannot be read in full
     */
    byte[] read(long offset, int length) throws IOException;
}
