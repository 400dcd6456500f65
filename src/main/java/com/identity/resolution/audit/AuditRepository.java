package com.identity.resolution.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only persistence for audit entries.
 * Implementations never update or delete an entry once saved.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    /**
     * Saves a batch of entries in order. Used when a run commits.
     */
    default void saveAll(List<AuditEntry> entries) {
        for (AuditEntry entry : entries) {
            save(entry);
        }
    }

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByRunId(String runId);

    List<AuditEntry> findByActorId(String actorId);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);
}
