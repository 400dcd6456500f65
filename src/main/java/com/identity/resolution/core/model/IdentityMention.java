package com.identity.resolution.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One ingested name occurrence with its parsed form and derived blocking data.
 * Immutable: corrections are made by ingesting a new mention, never by mutating this one.
 */
public final class IdentityMention {

    private final String mentionId;
    private final SourceReference sourceReference;
    private final String rawName;
    private final ParsedName parsed;
    private final ParseType parseType;
    private final double parseConfidence;
    private final String blockingKey;
    private final String comparisonName;
    private final float[] embedding;
    private final boolean protectedMarker;

    private IdentityMention(Builder builder) {
        this.mentionId = Objects.requireNonNull(builder.mentionId, "mentionId is required");
        this.sourceReference = Objects.requireNonNull(builder.sourceReference, "sourceReference is required");
        this.rawName = Objects.requireNonNull(builder.rawName, "rawName is required");
        this.parsed = builder.parsed != null ? builder.parsed : ParsedName.EMPTY;
        this.parseType = builder.parseType != null ? builder.parseType : ParseType.UNKNOWN;
        if (builder.parseConfidence < 0.0 || builder.parseConfidence > 1.0) {
            throw new IllegalArgumentException("parseConfidence must be between 0.0 and 1.0");
        }
        this.parseConfidence = builder.parseConfidence;
        this.blockingKey = builder.blockingKey != null ? builder.blockingKey : "";
        this.comparisonName = builder.comparisonName != null ? builder.comparisonName : "";
        this.embedding = builder.embedding != null ? builder.embedding.clone() : null;
        this.protectedMarker = builder.protectedMarker;
    }

    public String getMentionId() {
        return mentionId;
    }

    public SourceReference getSourceReference() {
        return sourceReference;
    }

    public String getRawName() {
        return rawName;
    }

    public ParsedName getParsed() {
        return parsed;
    }

    public ParseType getParseType() {
        return parseType;
    }

    public double getParseConfidence() {
        return parseConfidence;
    }

    /**
     * Phonetic blocking key. The empty string designates the low-confidence catch-all block.
     */
    public String getBlockingKey() {
        return blockingKey;
    }

    /**
     * Normalized full name used by the edit-similarity signal.
     */
    public String getComparisonName() {
        return comparisonName;
    }

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public int embeddingDimension() {
        return embedding != null ? embedding.length : 0;
    }

    public boolean isProtectedMarker() {
        return protectedMarker;
    }

    public boolean isParseFailure() {
        return parseConfidence == 0.0;
    }

    public boolean isUnblockable() {
        return blockingKey.isEmpty();
    }

    /**
     * Cosine similarity between the embeddings of two mentions mapped to [0,1],
     * or {@code null} when either side has no embedding or the dimensions differ.
     */
    public Double embeddingCosine(IdentityMention other) {
        if (!hasEmbedding() || !other.hasEmbedding() || embedding.length != other.embedding.length) {
            return null;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < embedding.length; i++) {
            dot += (double) embedding[i] * other.embedding[i];
            normA += (double) embedding[i] * embedding[i];
            normB += (double) other.embedding[i] * other.embedding[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityMention that = (IdentityMention) o;
        return mentionId.equals(that.mentionId);
    }

    @Override
    public int hashCode() {
        return mentionId.hashCode();
    }

    @Override
    public String toString() {
        return "IdentityMention{" +
                "mentionId='" + mentionId + '\'' +
                ", rawName='" + rawName + '\'' +
                ", parseType=" + parseType +
                ", parseConfidence=" + parseConfidence +
                ", blockingKey='" + blockingKey + '\'' +
                ", embedding=" + (embedding != null ? Arrays.toString(Arrays.copyOf(embedding, Math.min(3, embedding.length))) + "..." : "none") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String mentionId;
        private SourceReference sourceReference;
        private String rawName;
        private ParsedName parsed;
        private ParseType parseType;
        private double parseConfidence;
        private String blockingKey;
        private String comparisonName;
        private float[] embedding;
        private boolean protectedMarker;

        public Builder mentionId(String mentionId) {
            this.mentionId = mentionId;
            return this;
        }

        public Builder sourceReference(SourceReference sourceReference) {
            this.sourceReference = sourceReference;
            return this;
        }

        public Builder rawName(String rawName) {
            this.rawName = rawName;
            return this;
        }

        public Builder parsed(ParsedName parsed) {
            this.parsed = parsed;
            return this;
        }

        public Builder parseType(ParseType parseType) {
            this.parseType = parseType;
            return this;
        }

        public Builder parseConfidence(double parseConfidence) {
            this.parseConfidence = parseConfidence;
            return this;
        }

        public Builder blockingKey(String blockingKey) {
            this.blockingKey = blockingKey;
            return this;
        }

        public Builder comparisonName(String comparisonName) {
            this.comparisonName = comparisonName;
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder protectedMarker(boolean protectedMarker) {
            this.protectedMarker = protectedMarker;
            return this;
        }

        public IdentityMention build() {
            return new IdentityMention(this);
        }
    }
}
