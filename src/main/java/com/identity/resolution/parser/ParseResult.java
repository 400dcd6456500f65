package com.identity.resolution.parser;

import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ParsedName;

import java.util.Objects;

/**
 * Adapter output: the fixed tagged variant the rest of the pipeline consumes.
 */
public record ParseResult(ParsedName parsed, ParseType type, double confidence) {

    public static final ParseResult FAILED = new ParseResult(ParsedName.EMPTY, ParseType.UNKNOWN, 0.0);

    public ParseResult {
        Objects.requireNonNull(parsed, "parsed is required");
        Objects.requireNonNull(type, "type is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public boolean isFailure() {
        return confidence == 0.0;
    }

    public ParseResult withType(ParseType newType) {
        return new ParseResult(parsed, newType, confidence);
    }
}
