package com.identity.resolution.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loosely typed parser output: component label to token text, plus a type tag.
 *
 * <p>Labels follow the CRF name-tagger vocabulary ({@code GivenName}, {@code Surname},
 * {@code FirstInitial}, {@code PrefixMarital}, {@code SuffixGenerational}, {@code Nickname},
 * {@code CorporationName}, ...). Type tags are {@code Person}, {@code Corporation} and
 * {@code Household}. {@link NameParser} implementations emit these strings and only
 * {@link NameParserAdapter} interprets them.</p>
 */
public record RawNameParse(Map<String, String> labels, String type) {

    public static final String TYPE_PERSON = "Person";
    public static final String TYPE_CORPORATION = "Corporation";
    public static final String TYPE_HOUSEHOLD = "Household";

    // Component labels
    public static final String PREFIX_MARITAL = "PrefixMarital";
    public static final String PREFIX_OTHER = "PrefixOther";
    public static final String GIVEN_NAME = "GivenName";
    public static final String FIRST_INITIAL = "FirstInitial";
    public static final String MIDDLE_NAME = "MiddleName";
    public static final String MIDDLE_INITIAL = "MiddleInitial";
    public static final String SURNAME = "Surname";
    public static final String LAST_INITIAL = "LastInitial";
    public static final String SUFFIX_GENERATIONAL = "SuffixGenerational";
    public static final String SUFFIX_OTHER = "SuffixOther";
    public static final String NICKNAME = "Nickname";
    public static final String CORPORATION_NAME = "CorporationName";
    public static final String SECOND_GIVEN_NAME = "SecondGivenName";
    public static final String SECOND_SURNAME = "SecondSurname";

    public RawNameParse {
        Objects.requireNonNull(type, "type is required");
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public String label(String name) {
        return labels.get(name);
    }

    public boolean has(String name) {
        return labels.containsKey(name);
    }
}
