package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * Transport-level failure: connection refused or reset, timeout, I/O error.
 */
public class UploadNetworkException extends UploadException {

    public UploadNetworkException(UploadStage stage, String sessionId, Integer chunkIndex, Throwable cause) {
        this(stage, sessionId, chunkIndex, List.of(), cause);
    }

    private UploadNetworkException(UploadStage stage, String sessionId, Integer chunkIndex,
                                   List<Integer> succeededChunks, Throwable cause) {
        super(stage, sessionId, chunkIndex, succeededChunks, message(stage, chunkIndex, cause), cause);
    }

    @Override
    public UploadNetworkException withContext(String sessionId, List<Integer> succeededChunks) {
        return keepTrace(new UploadNetworkException(getStage(), sessionId, getChunkIndex(), succeededChunks,
                getCause()));
    }

    private static String message(UploadStage stage, Integer chunkIndex, Throwable cause) {
        String target = chunkIndex != null ? stage.getAction() + " " + chunkIndex : stage.getAction();
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
        return "Failed to " + target + ": network error (" + reason + ")";
    }
}
