package com.identity.resolution.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured name components produced by the name parser adapter.
 * Every component is nullable; {@link #EMPTY} represents a failed parse.
 *
 * <p>{@code corporateName} is only populated for organizations.</p>
 */
public record ParsedName(
        String prefix,
        String given,
        String middle,
        String family,
        String suffix,
        String nickname,
        String corporateName
) {
    public static final ParsedName EMPTY = new ParsedName(null, null, null, null, null, null, null);

    public ParsedName {
        prefix = blankToNull(prefix);
        given = blankToNull(given);
        middle = blankToNull(middle);
        family = blankToNull(family);
        suffix = blankToNull(suffix);
        nickname = blankToNull(nickname);
        corporateName = blankToNull(corporateName);
    }

    public static ParsedName person(String given, String middle, String family) {
        return new ParsedName(null, given, middle, family, null, null, null);
    }

    public static ParsedName organization(String corporateName) {
        return new ParsedName(null, null, null, null, null, null, corporateName);
    }

    public boolean isEmpty() {
        return prefix == null && given == null && middle == null && family == null
                && suffix == null && nickname == null && corporateName == null;
    }

    public boolean hasGiven() {
        return given != null;
    }

    public boolean hasFamily() {
        return family != null;
    }

    /**
     * Joins given, middle, family and suffix (or the corporate name) in display order.
     * Prefix and nickname are not part of the identity-bearing name.
     */
    public String fullName() {
        if (corporateName != null) {
            return corporateName;
        }
        List<String> parts = new ArrayList<>(4);
        if (given != null) parts.add(given);
        if (middle != null) parts.add(middle);
        if (family != null) parts.add(family);
        if (suffix != null) parts.add(suffix);
        return String.join(" ", parts);
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
