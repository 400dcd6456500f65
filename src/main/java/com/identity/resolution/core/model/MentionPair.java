package com.identity.resolution.core.model;

import java.util.Objects;

/**
 * Unordered pair of mention ids stored in canonical order ({@code mentionIdA < mentionIdB}).
 */
public record MentionPair(String mentionIdA, String mentionIdB) implements Comparable<MentionPair> {

    public MentionPair {
        Objects.requireNonNull(mentionIdA, "mentionIdA is required");
        Objects.requireNonNull(mentionIdB, "mentionIdB is required");
        if (mentionIdA.equals(mentionIdB)) {
            throw new IllegalArgumentException("A mention cannot be paired with itself: " + mentionIdA);
        }
        if (mentionIdA.compareTo(mentionIdB) > 0) {
            String tmp = mentionIdA;
            mentionIdA = mentionIdB;
            mentionIdB = tmp;
        }
    }

    public static MentionPair of(String first, String second) {
        return new MentionPair(first, second);
    }

    public boolean contains(String mentionId) {
        return mentionIdA.equals(mentionId) || mentionIdB.equals(mentionId);
    }

    /**
     * Stable textual key, used for deduplication across runs.
     */
    public String key() {
        return mentionIdA + "::" + mentionIdB;
    }

    @Override
    public int compareTo(MentionPair other) {
        int cmp = mentionIdA.compareTo(other.mentionIdA);
        return cmp != 0 ? cmp : mentionIdB.compareTo(other.mentionIdB);
    }

    @Override
    public String toString() {
        return key();
    }
}
