package com.identity.resolution.blocking;

import com.identity.resolution.core.model.ParseType;
import com.identity.resolution.core.model.ParsedName;

/**
 * Strategy interface for deriving a mention's blocking key from its parsed name.
 *
 * <p>Each mention receives exactly one key. Mentions that share a key are compared
 * pairwise; the empty key designates the low-confidence catch-all block that collects
 * every mention whose name is too degenerate to key reliably.</p>
 */
public interface BlockingKeyStrategy {

    /** Key of the catch-all block. */
    String UNBLOCKABLE = "";

    /**
     * Generates the blocking key for a parsed name.
     *
     * @param parsed     structured name components
     * @param type       the mention's parse type
     * @param confidence the mention's parse confidence
     * @return the blocking key, or {@link #UNBLOCKABLE}
     */
    String generateKey(ParsedName parsed, ParseType type, double confidence);

    /**
     * Version tag recorded with every merge decision so keys stay comparable across runs.
     */
    String version();
}
