package com.identity.resolution.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AuditRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public void saveAll(List<AuditEntry> batch) {
        entries.addAll(batch);
    }

    @Override
    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByRunId(String runId) {
        return entries.stream()
                .filter(e -> runId.equals(e.runId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> snapshot = new ArrayList<>(entries);
        int size = snapshot.size();
        if (size <= limit) {
            return Collections.unmodifiableList(snapshot);
        }
        return Collections.unmodifiableList(new ArrayList<>(snapshot.subList(size - limit, size)));
    }
}
