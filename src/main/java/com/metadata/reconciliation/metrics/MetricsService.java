package com.metadata.reconciliation.metrics;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;

import java.time.Duration;

/**
 * Records reconciliation metrics. The default {@link NoOpMetricsService}
 * keeps the library usable without Micrometer on the classpath.
 */
public interface MetricsService {

    void recordMergeDuration(int recordCount, Duration duration);

    void recordMergeConfidence(double mergeConfidence);

    void incrementNoMetadataAvailable();

    void incrementInvalidRecord(String providerTag);

    void incrementFieldCorroborated(MetadataField field);

    void incrementOverrideApplied(MetadataField field, Provider provider);

    void incrementOverrideRejected(MetadataField field, Provider provider);

    void recordCacheHit();

    void recordCacheMiss();
}
