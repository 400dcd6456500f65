package com.identity.resolution.api;

import java.util.List;

/**
 * Thrown when the previously committed resolution state is inconsistent with the mention
 * repository, for example a link that references a mention which no longer exists.
 * Carries every offending id so the operator can repair the data in one pass.
 */
public class DataIntegrityException extends RuntimeException {

    private final List<String> offendingIds;

    public DataIntegrityException(String message, List<String> offendingIds) {
        super(message + ": " + offendingIds);
        this.offendingIds = List.copyOf(offendingIds);
    }

    public List<String> getOffendingIds() {
        return offendingIds;
    }
}
