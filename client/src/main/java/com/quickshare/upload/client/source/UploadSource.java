package com.quickshare.upload.client.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Content to upload: a name, a fixed size and a way to read byte ranges.
 *
 * <p>
 * The size must not change while an upload is running. Readers are opened per
 * attempt and closed by the orchestrator when the attempt ends.
 */
public interface UploadSource {

    /**
     * @return the name the file is uploaded under unless the caller overrides it
     */
    String getName();

    /**
     * @return total size in bytes
     */
    long getSize();

    /**
     * Opens a reader over the content.
     *
     * @return a new reader; the caller closes it
     * @throws IOException if the content cannot be opened
     */
    ChunkReader open() throws IOException;

    static UploadSource of(Path path) throws IOException {
        return new PathUploadSource(path);
    }

    static UploadSource of(String name, byte[] content) {
        return new ByteArrayUploadSource(name, content);
    }
}
