package com.identity.resolution.review;

import com.identity.resolution.core.model.CandidateOrigin;
import com.identity.resolution.core.model.MentionPair;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A mention pair awaiting a reviewer's decision.
 * Created when a candidate pair scores between the low and high thresholds.
 */
public class ReviewItem {

    private final String id;
    private final MentionPair pair;
    private final String rawNameA;
    private final String rawNameB;
    private final CandidateOrigin origin;
    private final double similarityScore;
    private final String runId;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.pair = Objects.requireNonNull(builder.pair, "pair is required");
        this.rawNameA = builder.rawNameA;
        this.rawNameB = builder.rawNameB;
        this.origin = builder.origin;
        this.similarityScore = builder.similarityScore;
        this.runId = builder.runId;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.reviewedAt = builder.reviewedAt;
        this.reviewerId = builder.reviewerId;
        this.notes = builder.notes;
    }

    public String getId() {
        return id;
    }

    public MentionPair getPair() {
        return pair;
    }

    public String getMentionIdA() {
        return pair.mentionIdA();
    }

    public String getMentionIdB() {
        return pair.mentionIdB();
    }

    public String getRawNameA() {
        return rawNameA;
    }

    public String getRawNameB() {
        return rawNameB;
    }

    public CandidateOrigin getOrigin() {
        return origin;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    /**
     * Run that first routed the pair to review.
     */
    public String getRunId() {
        return runId;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return getStatus() == ReviewStatus.PENDING;
    }

    public boolean isApproved() {
        return getStatus() == ReviewStatus.APPROVED;
    }

    public boolean isRejected() {
        return getStatus() == ReviewStatus.REJECTED;
    }

    synchronized void markApproved(String reviewerId, String notes) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    synchronized void markRejected(String reviewerId, String notes) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", pair=" + pair +
                ", score=" + similarityScore +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private MentionPair pair;
        private String rawNameA;
        private String rawNameB;
        private CandidateOrigin origin;
        private double similarityScore;
        private String runId;
        private ReviewStatus status;
        private Instant submittedAt;
        private Instant reviewedAt;
        private String reviewerId;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder pair(MentionPair pair) {
            this.pair = pair;
            return this;
        }

        public Builder rawNameA(String rawNameA) {
            this.rawNameA = rawNameA;
            return this;
        }

        public Builder rawNameB(String rawNameB) {
            this.rawNameB = rawNameB;
            return this;
        }

        public Builder origin(CandidateOrigin origin) {
            this.origin = origin;
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder reviewerId(String reviewerId) {
            this.reviewerId = reviewerId;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
