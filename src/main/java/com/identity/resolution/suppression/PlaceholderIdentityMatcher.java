package com.identity.resolution.suppression;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognizes raw names that are privacy placeholders rather than identities, e.g. {@code "Female (1)"}.
 * Patterns are matched case-insensitively against the whole trimmed raw name.
 */
public class PlaceholderIdentityMatcher {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "^(female|male)\\s*\\(?\\d*\\)?$",
            "^(jane|john)\\s+doe(\\s*\\(?\\d+\\)?)?$",
            "^(victim|minor)\\s*#?\\s*\\(?\\d*\\)?$"
    );

    private final List<Pattern> patterns;

    public PlaceholderIdentityMatcher(List<String> regexes) {
        Objects.requireNonNull(regexes, "regexes is required");
        this.patterns = regexes.stream()
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .collect(Collectors.toUnmodifiableList());
    }

    public static PlaceholderIdentityMatcher defaults() {
        return new PlaceholderIdentityMatcher(DEFAULT_PATTERNS);
    }

    public boolean matches(String rawName) {
        if (rawName == null) {
            return false;
        }
        String trimmed = rawName.trim();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(trimmed).matches()) {
                return true;
            }
        }
        return false;
    }
}
