package com.quickshare.upload.client.exception;

/**
 * Step of an upload attempt an error is attributed to.
 */
public enum UploadStage {
    /** Local checks before any network call: metadata validation, concurrent start. */
    PREFLIGHT("start upload"),
    INITIATE("initiate upload"),
    CHUNK("upload chunk"),
    FINALIZE("finalize upload");

    private final String action;

    UploadStage(String action) {
        this.action = action;
    }

    /**
     * @return short verb phrase used in error messages, e.g. "initiate upload"
     */
    public String getAction() {
        return action;
    }
}
