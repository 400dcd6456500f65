package com.identity.resolution.cache;

import com.identity.resolution.parser.ParseResult;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpParseCache implements ParseCache {

    @Override
    public Optional<ParseResult> get(String rawName) {
        return Optional.empty();
    }

    @Override
    public void put(String rawName, ParseResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
