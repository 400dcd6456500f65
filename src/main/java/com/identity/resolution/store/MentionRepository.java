package com.identity.resolution.store;

import com.identity.resolution.core.model.MentionRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only source of mention records fed to resolution runs.
 */
public interface MentionRepository {

    /**
     * @throws IllegalArgumentException if a mention with the same id was already added
     */
    void add(MentionRecord record);

    default void addAll(Collection<MentionRecord> records) {
        records.forEach(this::add);
    }

    Optional<MentionRecord> findById(String mentionId);

    /**
     * All records in insertion order.
     */
    List<MentionRecord> findAll();

    boolean exists(String mentionId);

    int count();
}
