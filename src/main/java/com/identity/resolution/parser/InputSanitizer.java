package com.identity.resolution.parser;

/**
 * Input validation for raw names entering a run.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a raw name. */
    public static final int MAX_RAW_NAME_LENGTH = 1000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a raw name for resolution.
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @param rawName the raw name to validate
     * @throws IllegalArgumentException if the name is invalid
     */
    public static void validateRawName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new IllegalArgumentException("Raw name must not be null or blank");
        }
        if (rawName.length() > MAX_RAW_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Raw name exceeds maximum length of " + MAX_RAW_NAME_LENGTH +
                            " characters (was " + rawName.length() + ")");
        }
        if (containsControlCharacters(rawName)) {
            throw new IllegalArgumentException("Raw name must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
