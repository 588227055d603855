package com.metadata.reconciliation.cache;

import com.metadata.reconciliation.core.model.MergedMetadata;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when caching is disabled.
 */
public class NoOpReconciliationCache implements ReconciliationCache {

    @Override
    public Optional<MergedMetadata> get(String fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(String fingerprint, MergedMetadata merged) {
        // no-op
    }

    @Override
    public void invalidate(String fingerprint) {
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
