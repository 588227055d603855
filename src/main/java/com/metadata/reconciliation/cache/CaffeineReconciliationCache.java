package com.metadata.reconciliation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.metadata.reconciliation.core.model.MergedMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed merge cache with size and write-TTL eviction.
 */
public class CaffeineReconciliationCache implements ReconciliationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineReconciliationCache.class);

    private final Cache<String, MergedMetadata> cache;

    public CaffeineReconciliationCache(CacheConfig config) {
        Objects.requireNonNull(config, "config is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<MergedMetadata> get(String fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(String fingerprint, MergedMetadata merged) {
        cache.put(fingerprint, merged);
    }

    @Override
    public void invalidate(String fingerprint) {
        cache.invalidate(fingerprint);
        log.debug("cache.invalidated fingerprint={}", fingerprint);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated all");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
