package com.metadata.reconciliation.cache;

import com.metadata.reconciliation.core.model.MergedMetadata;

import java.util.Optional;

/**
 * Cache of merge results keyed by a {@link RecordSetFingerprint} of the input records.
 */
public interface ReconciliationCache {

    /**
     * @param fingerprint fingerprint of the record set
     * @return the cached merge, or empty if not cached
     */
    Optional<MergedMetadata> get(String fingerprint);

    void put(String fingerprint, MergedMetadata merged);

    void invalidate(String fingerprint);

    void invalidateAll();

    CacheStats getStats();
}
