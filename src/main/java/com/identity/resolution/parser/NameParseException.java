package com.identity.resolution.parser;

/**
 * Thrown by a {@link NameParser} when a raw string cannot be tagged as a name.
 */
public class NameParseException extends Exception {

    private final String rawName;

    public NameParseException(String rawName, String message) {
        super(message);
        this.rawName = rawName;
    }

    public String getRawName() {
        return rawName;
    }
}
