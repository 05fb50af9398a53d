package com.quickshare.upload.client.source;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Upload source backed by a regular file. Chunks are read with positional
 * {@link FileChannel} reads, so only one chunk is held in memory at a time.
 */
public class PathUploadSource implements UploadSource {

    private final Path path;
    private final long size;

    /**
     * @param path file to upload; must exist and be a regular file
     * @throws IllegalArgumentException if the path is null or not a regular file
     * @throws IOException              if the size cannot be read
     */
    public PathUploadSource(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("filePath is required and must exist: " + path);
        }
        this.path = path;
        this.size = Files.size(path);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public long getSize() {
        return size;
    }

    @Override
    public ChunkReader open() throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        return new ChunkReader() {
            @Override
            public byte[] read(long offset, int length) throws IOException {
                byte[] buffer = new byte[length];
                ByteBuffer byteBuffer = ByteBuffer.wrap(buffer);
                long position = offset;
                while (byteBuffer.hasRemaining()) {
                    int read = channel.read(byteBuffer, position);
                    if (read < 0) {
                        throw new EOFException("Unexpected end of " + path + " at byte " + position
                                + " (expected " + (offset + length) + ")");
                    }
                    position += read;
                }
                return buffer;
            }

            @Override
            public void close() throws IOException {
                channel.close();
            }
        };
    }
}
