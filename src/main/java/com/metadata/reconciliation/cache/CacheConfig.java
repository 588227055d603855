package com.metadata.reconciliation.cache;

/**
 * Merge cache settings.
 *
 * @param maxSize    maximum number of cached merges
 * @param ttlSeconds seconds an entry lives after being written
 */
public record CacheConfig(long maxSize, long ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 entries, 300s TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 300);
    }
}
