package com.identity.resolution.parser;

/**
 * Seam for the external name tagger. Implementations must be thread-safe and pure:
 * the same input always yields the same output.
 */
public interface NameParser {

    /**
     * Tags the components of a raw name string.
     *
     * @param rawName the name as it appears in the source
     * @return labelled components and a type tag
     * @throws NameParseException if the string carries no usable name
     */
    RawNameParse parse(String rawName) throws NameParseException;
}
