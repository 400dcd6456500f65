package com.identity.resolution.resolution;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;

/**
 * Three-state classification of candidate pairs.
 * Cross-block embedding pairs must clear the stricter {@code crossBlockAutoMergeThreshold}
 * to auto-merge.
 */
public class EdgeClassifier {

    private final double tLow;
    private final double tHigh;
    private final double crossBlockAutoMergeThreshold;

    public EdgeClassifier(double tLow, double tHigh, double crossBlockAutoMergeThreshold) {
        if (tLow > tHigh) {
            throw new IllegalArgumentException("tLow must be <= tHigh");
        }
        if (crossBlockAutoMergeThreshold < tHigh) {
            throw new IllegalArgumentException("crossBlockAutoMergeThreshold must be >= tHigh");
        }
        this.tLow = tLow;
        this.tHigh = tHigh;
        this.crossBlockAutoMergeThreshold = crossBlockAutoMergeThreshold;
    }

    public EdgeDecision classify(CandidatePair pair) {
        double score = pair.compositeScore();
        if (score >= effectiveHigh(pair.origin())) {
            return EdgeDecision.AUTO_MERGE;
        }
        if (score >= tLow) {
            return EdgeDecision.REVIEW;
        }
        return EdgeDecision.NO_MATCH;
    }

    public double effectiveHigh(CandidateOrigin origin) {
        return origin == CandidateOrigin.EMBEDDING ? crossBlockAutoMergeThreshold : tHigh;
    }

    public double getTLow() {
        return tLow;
    }

    public double getTHigh() {
        return tHigh;
    }
}
