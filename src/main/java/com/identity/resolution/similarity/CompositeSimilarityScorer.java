package com.identity.resolution.similarity;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.CandidatePair;
import com.identity.resolution.core.model.IdentityMention;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.ScoreSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Combines phonetic agreement, edit similarity and embedding cosine into one composite score.
 *
 * <p>Formula: {@code score = (wp*phonetic + we*edit + wc*cosine) / (wp + we + wc)} where the
 * cosine term and its weight drop out when either mention lacks a comparable embedding.
 * Two different known types cap the result at {@code typeConflictCap}; pairs from the
 * catch-all block are capped at {@code lowConfidenceCap}.</p>
 *
 * <p>Pure and thread-safe.</p>
 */
public class CompositeSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final SimilarityWeights weights;
    private final SimilarityAlgorithm editAlgorithm;
    private final double typeConflictCap;
    private final double lowConfidenceCap;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights(), EditAlgorithm.LEVENSHTEIN, 0.40, 0.75);
    }

    public CompositeSimilarityScorer(SimilarityWeights weights, EditAlgorithm editAlgorithm,
                                     double typeConflictCap, double lowConfidenceCap) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.editAlgorithm = Objects.requireNonNull(editAlgorithm, "editAlgorithm is required").create();
        this.typeConflictCap = typeConflictCap;
        this.lowConfidenceCap = lowConfidenceCap;
    }

    public CandidatePair score(IdentityMention a, IdentityMention b, CandidateOrigin origin) {
        double phonetic = !a.isUnblockable() && a.getBlockingKey().equals(b.getBlockingKey()) ? 1.0 : 0.0;
        double edit = editAlgorithm.compute(a.getComparisonName(), b.getComparisonName());
        Double cosine = a.embeddingCosine(b);

        double numerator = weights.phoneticWeight() * phonetic + weights.editWeight() * edit
                + (cosine != null ? weights.embeddingWeight() * cosine : 0.0);
        double denominator = weights.presentWeight(cosine != null);
        double composite = denominator > 0.0 ? numerator / denominator : 0.0;

        boolean typeConflict = a.getParseType().conflictsWith(b.getParseType());
        boolean capApplied = false;
        if (typeConflict && composite > typeConflictCap) {
            composite = typeConflictCap;
            capApplied = true;
        }
        if (origin == CandidateOrigin.LOW_CONFIDENCE_BLOCK && composite > lowConfidenceCap) {
            composite = lowConfidenceCap;
            capApplied = true;
        }
        composite = Math.max(0.0, Math.min(1.0, composite));

        ScoreSignals signals = new ScoreSignals(phonetic, edit, cosine, typeConflict, capApplied);
        if (log.isTraceEnabled()) {
            log.trace("pair.scored a={} b={} origin={} composite={} signals={}",
                    a.getMentionId(), b.getMentionId(), origin, composite, signals);
        }
        return new CandidatePair(MentionPair.of(a.getMentionId(), b.getMentionId()), origin, composite, signals);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public String getEditAlgorithmName() {
        return editAlgorithm.getName();
    }
}
