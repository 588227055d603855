package com.metadata.reconciliation.metrics;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMergeDuration(int recordCount, Duration duration) {
    }

    @Override
    public void recordMergeConfidence(double mergeConfidence) {
    }

    @Override
    public void incrementNoMetadataAvailable() {
    }

    @Override
    public void incrementInvalidRecord(String providerTag) {
    }

    @Override
    public void incrementFieldCorroborated(MetadataField field) {
    }

    @Override
    public void incrementOverrideApplied(MetadataField field, Provider provider) {
    }

    @Override
    public void incrementOverrideRejected(MetadataField field, Provider provider) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
