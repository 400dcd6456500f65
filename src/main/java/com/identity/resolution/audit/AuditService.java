package com.identity.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service for recording and querying audit entries.
 * Entries produced inside a run are buffered by the run and handed over in one
 * {@link #recordAll(List)} call when the run commits.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("audit.recorded action={} subjectId={} actorId={} runId={}",
                entry.action(), entry.subjectId(), entry.actorId(), entry.runId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public void recordAll(List<AuditEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        repository.saveAll(entries);
        log.debug("audit.recordedBatch count={}", entries.size());
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return repository.findByRunId(runId);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
