package com.identity.resolution.core.model;

import java.util.Objects;

/**
 * A scored candidate pair. Ephemeral: persisted only through the merge decision log.
 */
public record CandidatePair(
        MentionPair pair,
        CandidateOrigin origin,
        double compositeScore,
        ScoreSignals signals
) {
    public CandidatePair {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(origin, "origin is required");
        Objects.requireNonNull(signals, "signals is required");
        if (compositeScore < 0.0 || compositeScore > 1.0 || Double.isNaN(compositeScore)) {
            throw new IllegalArgumentException("compositeScore must be between 0.0 and 1.0, got " + compositeScore);
        }
    }

    public String mentionIdA() {
        return pair.mentionIdA();
    }

    public String mentionIdB() {
        return pair.mentionIdB();
    }
}
