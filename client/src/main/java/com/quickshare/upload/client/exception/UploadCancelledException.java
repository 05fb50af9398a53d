package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * The attempt was aborted by the caller. Always takes precedence over a result
 * that arrives concurrently with the cancellation.
 */
public class UploadCancelledException extends UploadException {

    public UploadCancelledException(UploadStage stage, String sessionId, Integer chunkIndex, List<Integer> succeededChunks) {
        super(stage, sessionId, chunkIndex, succeededChunks, "Upload aborted", null);
    }

    @Override
    public UploadCancelledException withContext(String sessionId, List<Integer> succeededChunks) {
        return keepTrace(new UploadCancelledException(getStage(), sessionId, getChunkIndex(), succeededChunks));
    }
}
