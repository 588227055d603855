package com.metadata.reconciliation.cache;

/**
 * Snapshot of merge cache counters.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
