package com.identity.resolution.api;

/**
 * Thrown when a resolution run stops before committing. The previous snapshot stays in place.
 */
public class ResolutionAbortedException extends RuntimeException {

    private final String runId;

    public ResolutionAbortedException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
