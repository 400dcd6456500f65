package com.identity.resolution.audit;

import com.identity.resolution.core.model.EdgeDecision;
import com.identity.resolution.core.model.MentionPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of merge decisions. Records cannot be modified or removed;
 * a run's records are appended in one batch when the run commits.
 */
public class MergeDecisionLog {
    private static final Logger log = LoggerFactory.getLogger(MergeDecisionLog.class);

    private final List<MergeDecisionRecord> records;

    public MergeDecisionLog() {
        this.records = new CopyOnWriteArrayList<>();
    }

    public MergeDecisionRecord append(MergeDecisionRecord record) {
        records.add(record);
        return record;
    }

    public void appendAll(List<MergeDecisionRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        records.addAll(batch);
        log.info("decisions.appended runId={} count={} total={}", batch.get(0).runId(), batch.size(), records.size());
    }

    public List<MergeDecisionRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeDecisionRecord> getRecordsForRun(String runId) {
        return records.stream()
                .filter(r -> r.runId().equals(runId))
                .collect(Collectors.toList());
    }

    public List<MergeDecisionRecord> getRecordsForMention(String mentionId) {
        return records.stream()
                .filter(r -> r.mentionIdA().equals(mentionId) || r.mentionIdB().equals(mentionId))
                .collect(Collectors.toList());
    }

    public List<MergeDecisionRecord> getRecordsByOutcome(EdgeDecision outcome) {
        return records.stream()
                .filter(r -> r.outcome() == outcome)
                .collect(Collectors.toList());
    }

    /**
     * Latest decision recorded for a pair, across all runs.
     */
    public Optional<MergeDecisionRecord> latestFor(MentionPair pair) {
        MergeDecisionRecord latest = null;
        for (MergeDecisionRecord r : records) {
            if (r.mentionIdA().equals(pair.mentionIdA()) && r.mentionIdB().equals(pair.mentionIdB())) {
                latest = r;
            }
        }
        return Optional.ofNullable(latest);
    }

    public int size() {
        return records.size();
    }
}
