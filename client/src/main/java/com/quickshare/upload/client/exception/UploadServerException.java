package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * The server answered, but not with an acceptable response: either a non-success
 * status (with the message taken from the error envelope when present) or a
 * success status whose body does not match the expected payload.
 */
public class UploadServerException extends UploadException {

    private final int statusCode;
    private final String error;

    public UploadServerException(UploadStage stage, String sessionId, Integer chunkIndex, int statusCode, String error) {
        this(stage, sessionId, chunkIndex, List.of(), statusCode, error);
    }

    private UploadServerException(UploadStage stage, String sessionId, Integer chunkIndex,
                                  List<Integer> succeededChunks, int statusCode, String error) {
        super(stage, sessionId, chunkIndex, succeededChunks, message(stage, chunkIndex, statusCode, error), null);
        this.statusCode = statusCode;
        this.error = error;
    }

    @Override
    public UploadServerException withContext(String sessionId, List<Integer> succeededChunks) {
        return keepTrace(new UploadServerException(getStage(), sessionId, getChunkIndex(), succeededChunks,
                statusCode, error));
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the server's error message, or a description of the malformed payload
     */
    public String getError() {
        return error;
    }

    private static String message(UploadStage stage, Integer chunkIndex, int statusCode, String error) {
        String target = chunkIndex != null ? stage.getAction() + " " + chunkIndex : stage.getAction();
        return String.format("Failed to %s: %s (HTTP %d)", target, error, statusCode);
    }
}
