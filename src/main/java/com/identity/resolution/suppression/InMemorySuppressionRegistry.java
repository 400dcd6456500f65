package com.identity.resolution.suppression;

import com.identity.resolution.core.model.SuppressionReason;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SuppressionRegistry}.
 */
public class InMemorySuppressionRegistry implements SuppressionRegistry {

    private final ConcurrentMap<String, SuppressionRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean isSuppressed(String mentionId) {
        return records.containsKey(mentionId);
    }

    @Override
    public Optional<SuppressionRecord> find(String mentionId) {
        return Optional.ofNullable(records.get(mentionId));
    }

    @Override
    public Set<String> suppressedMentionIds() {
        return Set.copyOf(new TreeSet<>(records.keySet()));
    }

    @Override
    public int suppressAll(Map<String, Set<SuppressionReason>> reasonsByMention, String runId) {
        Instant now = Instant.now();
        int added = 0;
        for (Map.Entry<String, Set<SuppressionReason>> entry : reasonsByMention.entrySet()) {
            SuppressionRecord record = new SuppressionRecord(entry.getKey(), runId, entry.getValue(), now);
            if (records.putIfAbsent(entry.getKey(), record) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public boolean lift(String mentionId) {
        return records.remove(mentionId) != null;
    }

    @Override
    public int size() {
        return records.size();
    }
}
