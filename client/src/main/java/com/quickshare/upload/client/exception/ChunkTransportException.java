package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * A chunk could not be transferred. Terminal for the attempt: no later chunk is
 * sent and the session is never finalized.
 *
 * <p>
 * The cause is the transport's own error, typically an
 * {@link UploadNetworkException} or {@link UploadServerException}.
 */
public class ChunkTransportException extends UploadException {

    public ChunkTransportException(String sessionId, int chunkIndex, List<Integer> succeededChunks, Throwable cause) {
        super(UploadStage.CHUNK, sessionId, chunkIndex, succeededChunks,
                "Failed to upload chunk " + chunkIndex + ": " + (cause != null ? cause.getMessage() : "unknown error"),
                cause);
    }

    @Override
    public ChunkTransportException withContext(String sessionId, List<Integer> succeededChunks) {
        return keepTrace(new ChunkTransportException(sessionId, getChunkIndex(), succeededChunks, getCause()));
    }
}
