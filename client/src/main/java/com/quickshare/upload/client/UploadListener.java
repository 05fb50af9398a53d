package com.quickshare.upload.client;

import com.quickshare.upload.model.ProgressSnapshot;
import com.quickshare.upload.model.UploadState;

/**
 * Receives state changes and progress snapshots of an upload.
 *
 * <p>
 * Callbacks are invoked one at a time, in the order the events happened, after
 * the orchestrator released its lock; a listener may query or cancel the
 * orchestrator. Callbacks run on the upload's threads and should return quickly.
 * Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface UploadListener {

    UploadListener NONE = new UploadListener() {
    };

    default void onStateChanged(UploadState previous, UploadState current) {
    }

    /**
     * Called on every chunk status or partial-progress change. Within one attempt
     * the reported bytes and percentage never decrease.
     */
    default void onProgress(ProgressSnapshot snapshot) {
    }
}
