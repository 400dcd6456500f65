package com.identity.resolution.blocking;

import com.identity.resolution.core.model.IdentityMention;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable mapping from blocking key to the mentions carrying it, built once per run.
 *
 * <p>Every mention lands in exactly one block. Blocks and their member lists are sorted
 * (by key, then by mention id) so iteration order is deterministic. The instance is shared
 * by reference with scoring workers and never mutated after construction.</p>
 */
public final class BlockingIndex {

    private final Map<String, List<IdentityMention>> blocks;
    private final Map<String, String> keyByMentionId;
    private final int mentionCount;

    private BlockingIndex(Map<String, List<IdentityMention>> blocks, Map<String, String> keyByMentionId) {
        this.blocks = blocks;
        this.keyByMentionId = keyByMentionId;
        this.mentionCount = keyByMentionId.size();
    }

    /**
     * Builds the index from ingested mentions.
     *
     * @throws IllegalArgumentException if two mentions share a mention id
     */
    public static BlockingIndex build(Collection<IdentityMention> mentions) {
        Map<String, List<IdentityMention>> grouped = new TreeMap<>();
        Map<String, String> keyByMentionId = new HashMap<>();
        for (IdentityMention mention : mentions) {
            if (keyByMentionId.putIfAbsent(mention.getMentionId(), mention.getBlockingKey()) != null) {
                throw new IllegalArgumentException("Duplicate mention id in blocking index: " + mention.getMentionId());
            }
            grouped.computeIfAbsent(mention.getBlockingKey(), k -> new ArrayList<>()).add(mention);
        }

        Map<String, List<IdentityMention>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<IdentityMention>> entry : grouped.entrySet()) {
            List<IdentityMention> members = entry.getValue();
            members.sort(Comparator.comparing(IdentityMention::getMentionId));
            frozen.put(entry.getKey(), Collections.unmodifiableList(members));
        }
        return new BlockingIndex(Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(keyByMentionId));
    }

    public Set<String> keys() {
        return blocks.keySet();
    }

    public Map<String, List<IdentityMention>> blocks() {
        return blocks;
    }

    public List<IdentityMention> block(String key) {
        return blocks.getOrDefault(key, List.of());
    }

    /**
     * Members of the low-confidence catch-all block.
     */
    public List<IdentityMention> catchAll() {
        return block(BlockingKeyStrategy.UNBLOCKABLE);
    }

    public String keyOf(String mentionId) {
        return keyByMentionId.get(mentionId);
    }

    public int blockCount() {
        return blocks.size();
    }

    public int mentionCount() {
        return mentionCount;
    }

    public int largestBlockSize() {
        return blocks.values().stream().mapToInt(List::size).max().orElse(0);
    }
}
