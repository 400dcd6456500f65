package com.identity.resolution.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A canonical identity produced by clustering mentions.
 * Immutable; a suppressed copy is derived with {@link #withSuppression(Set)}.
 */
public final class ResolvedEntity {

    private final String entityId;
    private final String canonicalName;
    private final String canonicalMentionId;
    private final ParseType entityType;
    private final SortedSet<String> memberMentionIds;
    private final boolean verified;
    private final double bestParseConfidence;
    private final Set<SuppressionReason> suppressionReasons;

    private ResolvedEntity(Builder builder) {
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId is required");
        this.canonicalName = Objects.requireNonNull(builder.canonicalName, "canonicalName is required");
        this.canonicalMentionId = Objects.requireNonNull(builder.canonicalMentionId, "canonicalMentionId is required");
        this.entityType = builder.entityType != null ? builder.entityType : ParseType.UNKNOWN;
        if (builder.memberMentionIds.isEmpty()) {
            throw new IllegalArgumentException("An entity needs at least one member mention");
        }
        if (!builder.memberMentionIds.contains(canonicalMentionId)) {
            throw new IllegalArgumentException("canonicalMentionId must be a member: " + canonicalMentionId);
        }
        this.memberMentionIds = Collections.unmodifiableSortedSet(new TreeSet<>(builder.memberMentionIds));
        this.verified = builder.verified;
        this.bestParseConfidence = builder.bestParseConfidence;
        this.suppressionReasons = builder.suppressionReasons.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.suppressionReasons));
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getCanonicalMentionId() {
        return canonicalMentionId;
    }

    public ParseType getEntityType() {
        return entityType;
    }

    public SortedSet<String> getMemberMentionIds() {
        return memberMentionIds;
    }

    public int size() {
        return memberMentionIds.size();
    }

    public boolean isSingleton() {
        return memberMentionIds.size() == 1;
    }

    public boolean isVerified() {
        return verified;
    }

    public double getBestParseConfidence() {
        return bestParseConfidence;
    }

    public boolean isSuppressFromPublic() {
        return !suppressionReasons.isEmpty();
    }

    public Set<SuppressionReason> getSuppressionReasons() {
        return suppressionReasons;
    }

    public ResolvedEntity withSuppression(Set<SuppressionReason> reasons) {
        return toBuilder().suppressionReasons(reasons).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .entityId(entityId)
                .canonicalName(canonicalName)
                .canonicalMentionId(canonicalMentionId)
                .entityType(entityType)
                .memberMentionIds(memberMentionIds)
                .verified(verified)
                .bestParseConfidence(bestParseConfidence)
                .suppressionReasons(suppressionReasons);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedEntity that = (ResolvedEntity) o;
        return verified == that.verified
                && Double.compare(that.bestParseConfidence, bestParseConfidence) == 0
                && entityId.equals(that.entityId)
                && canonicalName.equals(that.canonicalName)
                && canonicalMentionId.equals(that.canonicalMentionId)
                && entityType == that.entityType
                && memberMentionIds.equals(that.memberMentionIds)
                && suppressionReasons.equals(that.suppressionReasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, canonicalName, canonicalMentionId, entityType, memberMentionIds,
                verified, bestParseConfidence, suppressionReasons);
    }

    @Override
    public String toString() {
        return "ResolvedEntity{" +
                "entityId='" + entityId + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", entityType=" + entityType +
                ", members=" + memberMentionIds.size() +
                ", verified=" + verified +
                ", suppressionReasons=" + suppressionReasons +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityId;
        private String canonicalName;
        private String canonicalMentionId;
        private ParseType entityType;
        private final SortedSet<String> memberMentionIds = new TreeSet<>();
        private boolean verified;
        private double bestParseConfidence;
        private final Set<SuppressionReason> suppressionReasons = EnumSet.noneOf(SuppressionReason.class);

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder canonicalMentionId(String canonicalMentionId) {
            this.canonicalMentionId = canonicalMentionId;
            return this;
        }

        public Builder entityType(ParseType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder memberMentionIds(Set<String> memberMentionIds) {
            this.memberMentionIds.clear();
            this.memberMentionIds.addAll(memberMentionIds);
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder bestParseConfidence(double bestParseConfidence) {
            this.bestParseConfidence = bestParseConfidence;
            return this;
        }

        public Builder suppressionReasons(Set<SuppressionReason> reasons) {
            this.suppressionReasons.clear();
            this.suppressionReasons.addAll(reasons);
            return this;
        }

        public ResolvedEntity build() {
            return new ResolvedEntity(this);
        }
    }
}
