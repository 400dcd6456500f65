package com.identity.resolution.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param subjectId the run, mention, entity or review item the action concerns
 * @param runId     the run that produced the entry, or {@code null} for out-of-run actions
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        String runId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String subjectId;
        private String actorId;
        private String runId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subjectId, actorId, runId, details, timestamp);
        }
    }
}
