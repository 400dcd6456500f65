package com.identity.resolution.core.model;

/**
 * Optional structured hints supplied by the mention-extraction collaborator.
 *
 * @param declaredType    entity type already known upstream, or null
 * @param protectedMarker true when upstream marks the mention as protected (e.g. potential victim)
 */
public record MentionHints(ParseType declaredType, boolean protectedMarker) {

    private static final MentionHints NONE = new MentionHints(null, false);

    public static MentionHints none() {
        return NONE;
    }

    public static MentionHints protectedMention() {
        return new MentionHints(null, true);
    }

    public static MentionHints declared(ParseType type) {
        return new MentionHints(type, false);
    }
}
