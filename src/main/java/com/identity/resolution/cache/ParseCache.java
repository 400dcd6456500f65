package com.identity.resolution.cache;

import com.identity.resolution.parser.ParseResult;

import java.util.Optional;

/**
 * Cache of name parse results keyed by the exact raw name.
 * Parsing is pure, so entries never need targeted invalidation.
 */
public interface ParseCache {

    /**
     * Gets a cached parse result.
     *
     * @param rawName the raw name exactly as ingested
     * @return the cached result, or empty if not cached
     */
    Optional<ParseResult> get(String rawName);

    void put(String rawName, ParseResult result);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache described by the given configuration.
     */
    static ParseCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineParseCache(config) : new NoOpParseCache();
    }
}
