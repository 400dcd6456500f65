package com.identity.resolution.resolution;

import com.identity.resolution.core.model.MentionPair;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reviewer decisions fed into a run: approved pairs are merged unconditionally,
 * rejected pairs may never end up in the same entity.
 */
public final class ReviewOverrides {

    private static final ReviewOverrides EMPTY = new ReviewOverrides(Set.of(), Set.of());

    private final Set<MentionPair> forcedMerges;
    private final Set<MentionPair> cannotLinks;

    public ReviewOverrides(Set<MentionPair> forcedMerges, Set<MentionPair> cannotLinks) {
        this.forcedMerges = Collections.unmodifiableSet(new TreeSet<>(forcedMerges));
        this.cannotLinks = Collections.unmodifiableSet(new TreeSet<>(cannotLinks));
    }

    public static ReviewOverrides empty() {
        return EMPTY;
    }

    public boolean isForced(MentionPair pair) {
        return forcedMerges.contains(pair);
    }

    public boolean isCannotLink(MentionPair pair) {
        return cannotLinks.contains(pair);
    }

    public Set<MentionPair> getForcedMerges() {
        return forcedMerges;
    }

    public Set<MentionPair> getCannotLinks() {
        return cannotLinks;
    }

    public boolean isEmpty() {
        return forcedMerges.isEmpty() && cannotLinks.isEmpty();
    }

    @Override
    public String toString() {
        return "ReviewOverrides{forced=" + forcedMerges.size() + ", cannotLink=" + cannotLinks.size() + '}';
    }
}
