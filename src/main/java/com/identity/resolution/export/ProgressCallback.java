package com.identity.resolution.export;

/**
 * Callback interface for tracking progress of export operations.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of records processed so far
     * @param total     the total number of records (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
