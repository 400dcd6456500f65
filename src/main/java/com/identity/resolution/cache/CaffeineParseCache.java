package com.identity.resolution.cache;

import com.identity.resolution.parser.ParseResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed parse cache. Thread-safe; shared by the ingestion workers of a run.
 */
public class CaffeineParseCache implements ParseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineParseCache.class);

    private final Cache<String, ParseResult> cache;

    public CaffeineParseCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineParseCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ParseResult> get(String rawName) {
        return Optional.ofNullable(cache.getIfPresent(rawName));
    }

    @Override
    public void put(String rawName, ParseResult result) {
        cache.put(rawName, result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all parse cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
