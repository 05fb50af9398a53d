package com.quickshare.upload.client.exception;

import java.util.List;

/**
 * Thrown when upload metadata is rejected before any network call is made.
 */
public class UploadValidationException extends UploadException {

    private final List<String> violations;

    public UploadValidationException(List<String> violations) {
        super(UploadStage.PREFLIGHT, "Invalid upload metadata: " + String.join("; ", violations), null);
        this.violations = List.copyOf(violations);
    }

    public UploadValidationException(String violation) {
        this(List.of(violation));
    }

    /**
     * @return the individual constraint violations, formatted as {@code "property: message"}
     */
    public List<String> getViolations() {
        return violations;
    }
}
