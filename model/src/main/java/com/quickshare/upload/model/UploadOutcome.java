package com.quickshare.upload.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a completed upload: the session that was closed and the locator the
 * assembled file can be retrieved from.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class UploadOutcome {

    private final String sessionId;

    /** Download URL returned by the server when the session was completed. */
    private final String downloadLocator;

    public UploadOutcome(String sessionId, String downloadLocator) {
        this.sessionId = sessionId;
        this.downloadLocator = downloadLocator;
    }
}
