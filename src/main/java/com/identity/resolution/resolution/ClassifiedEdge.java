package com.identity.resolution.resolution;

import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.EdgeDecision;

/**
 * A candidate pair with its final decision and the high threshold that applied to it.
 */
public record ClassifiedEdge(CandidatePair candidate, EdgeDecision decision, double effectiveHigh) {
}
