package com.identity.resolution.audit;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.MentionPair;
import com.identity.resolution.core.model.ScoreSignals;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one classified candidate pair, with everything needed to explain
 * the decision later: signals, thresholds in force and the keying/model versions.
 */
public record MergeDecisionRecord(
        String id,
        String runId,
        String mentionIdA,
        String mentionIdB,
        CandidateOrigin origin,
        double compositeScore,
        ScoreSignals signals,
        EdgeDecision outcome,
        double tLow,
        double tHigh,
        String blockingKeyVersion,
        String embeddingModelId,
        Instant evaluatedAt
) {
    public MergeDecisionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(mentionIdA, "mentionIdA is required");
        Objects.requireNonNull(mentionIdB, "mentionIdB is required");
        Objects.requireNonNull(origin, "origin is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(evaluatedAt, "evaluatedAt is required");
    }

    public MentionPair pair() {
        return MentionPair.of(mentionIdA, mentionIdB);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String runId;
        private String mentionIdA;
        private String mentionIdB;
        private CandidateOrigin origin;
        private double compositeScore;
        private ScoreSignals signals;
        private EdgeDecision outcome;
        private double tLow;
        private double tHigh;
        private String blockingKeyVersion;
        private String embeddingModelId;
        private Instant evaluatedAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder pair(MentionPair pair) {
            this.mentionIdA = pair.mentionIdA();
            this.mentionIdB = pair.mentionIdB();
            return this;
        }

        public Builder origin(CandidateOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder compositeScore(double compositeScore) {
            this.compositeScore = compositeScore;
            return this;
        }

        public Builder signals(ScoreSignals signals) {
            this.signals = signals;
            return this;
        }

        public Builder outcome(EdgeDecision outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder thresholds(double tLow, double tHigh) {
            this.tLow = tLow;
            this.tHigh = tHigh;
            return this;
        }

        public Builder blockingKeyVersion(String blockingKeyVersion) {
            this.blockingKeyVersion = blockingKeyVersion;
            return this;
        }

        public Builder embeddingModelId(String embeddingModelId) {
            this.embeddingModelId = embeddingModelId;
            return this;
        }

        public Builder evaluatedAt(Instant evaluatedAt) {
            this.evaluatedAt = evaluatedAt;
            return this;
        }

        public MergeDecisionRecord build() {
            return new MergeDecisionRecord(id, runId, mentionIdA, mentionIdB, origin, compositeScore, signals,
                    outcome, tLow, tHigh, blockingKeyVersion, embeddingModelId, evaluatedAt);
        }
    }
}
