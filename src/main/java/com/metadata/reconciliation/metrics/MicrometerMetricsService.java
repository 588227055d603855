package com.metadata.reconciliation.metrics;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code metadata.merge.duration}: Timer (tag: records)</li>
 *   <li>{@code metadata.merge.confidence}: DistributionSummary</li>
 *   <li>{@code metadata.merge.unavailable}: Counter</li>
 *   <li>{@code metadata.record.invalid}: Counter (tag: provider)</li>
 *   <li>{@code metadata.field.corroborated}: Counter (tag: field)</li>
 *   <li>{@code metadata.override.applied}: Counter (tags: field, provider)</li>
 *   <li>{@code metadata.override.rejected}: Counter (tags: field, provider)</li>
 *   <li>{@code metadata.cache.hit}, {@code metadata.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {
    static final String UNKNOWN_PROVIDER = "unknown";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary mergeConfidenceSummary;
    private final Counter unavailableCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergeConfidenceSummary = DistributionSummary.builder("metadata.merge.confidence")
                .description("Distribution of merge confidence across reconciliations")
                .register(registry);
        this.unavailableCounter = Counter.builder("metadata.merge.unavailable")
                .description("Merges attempted with no usable source records")
                .register(registry);
        this.cacheHitCounter = Counter.builder("metadata.cache.hit")
                .description("Number of merge cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("metadata.cache.miss")
                .description("Number of merge cache misses")
                .register(registry);
    }

    @Override
    public void recordMergeDuration(int recordCount, Duration duration) {
        String records = String.valueOf(recordCount);
        Timer timer = timerCache.computeIfAbsent(records, k ->
                Timer.builder("metadata.merge.duration")
                        .description("Duration of merge operations")
                        .tag("records", records)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordMergeConfidence(double mergeConfidence) {
        mergeConfidenceSummary.record(mergeConfidence);
    }

    @Override
    public void incrementNoMetadataAvailable() {
        unavailableCounter.increment();
    }

    @Override
    public void incrementInvalidRecord(String providerTag) {
        String provider = providerTag == null || providerTag.isBlank() ? UNKNOWN_PROVIDER : providerTag;
        counter("invalid:" + provider, "metadata.record.invalid", "Source payloads dropped as invalid",
                "provider", provider).increment();
    }

    @Override
    public void incrementFieldCorroborated(MetadataField field) {
        counter("corroborated:" + field.getKey(), "metadata.field.corroborated",
                "Fields on which two or more providers agreed", "field", field.getKey()).increment();
    }

    @Override
    public void incrementOverrideApplied(MetadataField field, Provider provider) {
        overrideCounter("metadata.override.applied", "Field pins applied", field, provider).increment();
    }

    @Override
    public void incrementOverrideRejected(MetadataField field, Provider provider) {
        overrideCounter("metadata.override.rejected", "Field pins rejected", field, provider).increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private Counter overrideCounter(String name, String description, MetadataField field, Provider provider) {
        String key = name + ":" + field.getKey() + ":" + provider.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("field", field.getKey())
                        .tag("provider", provider.name().toLowerCase(Locale.ROOT))
                        .register(registry));
    }
}
