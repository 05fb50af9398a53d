package com.quickshare.upload.client.exception;

import com.quickshare.upload.model.UploadState;

/**
 * Thrown when an upload is started while another attempt is still active on the
 * same orchestrator. The active attempt is left untouched.
 */
public class ConcurrentUploadException extends UploadException {

    private final UploadState activeState;

    public ConcurrentUploadException(UploadState activeState) {
        super(UploadStage.PREFLIGHT, "Another upload is already in progress (state=" + activeState + ")", null);
        this.activeState = activeState;
    }

    public UploadState getActiveState() {
        return activeState;
    }
}
