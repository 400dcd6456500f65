package com.identity.resolution.store;

import com.identity.resolution.core.model.MentionRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory implementation of {@link MentionRepository}.
 */
public class InMemoryMentionRepository implements MentionRepository {

    private final Map<String, MentionRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void add(MentionRecord record) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(record.mentionId(), "mentionId is required");
        if (records.containsKey(record.mentionId())) {
            throw new IllegalArgumentException("Mention already exists: " + record.mentionId());
        }
        records.put(record.mentionId(), record);
    }

    @Override
    public synchronized Optional<MentionRecord> findById(String mentionId) {
        return Optional.ofNullable(records.get(mentionId));
    }

    @Override
    public synchronized List<MentionRecord> findAll() {
        return List.copyOf(new ArrayList<>(records.values()));
    }

    @Override
    public synchronized boolean exists(String mentionId) {
        return records.containsKey(mentionId);
    }

    @Override
    public synchronized int count() {
        return records.size();
    }
}
