package com.identity.resolution.suppression;

import com.identity.resolution.core.model.SuppressionReason;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent set of suppressed mention ids.
 *
 * <p>Runs only ever add to the registry, which keeps suppression monotonic: once any
 * member of an entity has been suppressed, every later entity containing it is suppressed
 * too. {@link #lift(String)} exists for the audited administrative path only.</p>
 */
public interface SuppressionRegistry {

    boolean isSuppressed(String mentionId);

    Optional<SuppressionRecord> find(String mentionId);

    Set<String> suppressedMentionIds();

    /**
     * Adds mentions to the registry. Mentions already present keep their original record.
     *
     * @param reasonsByMention reasons per mention id
     * @return number of newly suppressed mentions
     */
    int suppressAll(Map<String, Set<SuppressionReason>> reasonsByMention, String runId);

    /**
     * Removes a mention from the registry.
     *
     * @return true if the mention was suppressed
     */
    boolean lift(String mentionId);

    int size();
}
