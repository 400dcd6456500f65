package com.identity.resolution.rules;

import com.identity.resolution.core.model.ParseType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One regex rewrite applied to a name before comparison.
 *
 * @param name        identifier used in trace logs
 * @param pattern     case-insensitive pattern to rewrite
 * @param replacement replacement text, may be empty
 * @param types       parse types the rule is scoped to; empty means every type, including untyped input
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<ParseType> types,
                                int priority) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        types = types != null ? Set.copyOf(types) : Set.of();
    }

    /**
     * A rule applied to every name whatever its parse type.
     */
    public static NormalizationRule common(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, FLAGS), replacement, Set.of(), priority);
    }

    /**
     * A rule applied only to names parsed as one of the given types.
     */
    public static NormalizationRule scoped(String name, String regex, String replacement, int priority,
                                           ParseType first, ParseType... rest) {
        return new NormalizationRule(name, Pattern.compile(regex, FLAGS), replacement, EnumSet.of(first, rest),
                priority);
    }

    /**
     * Untyped input ({@code type == null}) only receives common rules.
     */
    public boolean appliesTo(ParseType type) {
        if (types.isEmpty()) {
            return true;
        }
        return type != null && types.contains(type);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
