package com.metadata.reconciliation.api;

import com.metadata.reconciliation.cache.CacheConfig;
import com.metadata.reconciliation.cache.CaffeineReconciliationCache;
import com.metadata.reconciliation.cache.NoOpReconciliationCache;
import com.metadata.reconciliation.cache.ReconciliationCache;
import com.metadata.reconciliation.cache.RecordSetFingerprint;
import com.metadata.reconciliation.core.model.FieldPin;
import com.metadata.reconciliation.core.model.FieldResolution;
import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.core.model.TrackQuery;
import com.metadata.reconciliation.corroboration.CorroborationDetector;
import com.metadata.reconciliation.logging.LogContext;
import com.metadata.reconciliation.merge.MergeEngine;
import com.metadata.reconciliation.merge.NoMetadataAvailableException;
import com.metadata.reconciliation.merge.OverrideApplier;
import com.metadata.reconciliation.merge.OverrideResult;
import com.metadata.reconciliation.merge.RejectedOverride;
import com.metadata.reconciliation.metrics.MetricsService;
import com.metadata.reconciliation.metrics.NoOpMetricsService;
import com.metadata.reconciliation.rules.DefaultNormalizationRules;
import com.metadata.reconciliation.rules.NormalizationEngine;
import com.metadata.reconciliation.scoring.RecordScorer;
import com.metadata.reconciliation.similarity.JaccardSimilarity;
import com.metadata.reconciliation.source.ConfidenceRules;
import com.metadata.reconciliation.source.NormalizationBatch;
import com.metadata.reconciliation.source.PayloadFieldExtractor;
import com.metadata.reconciliation.source.SourceNormalizer;
import com.metadata.reconciliation.tracing.NoOpTracingService;
import com.metadata.reconciliation.tracing.Span;
import com.metadata.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point for metadata reconciliation.
 *
 * <p>Usage:</p>
 * <pre>
 * MetadataReconciler reconciler = MetadataReconciler.builder()
 *     .options(ReconciliationOptions.builder().cachingEnabled(true).build())
 *     .build();
 *
 * ReconciliationResult result = reconciler.reconcile(
 *     TrackQuery.of("Bohemian Rhapsody", "Queen"), payloads);
 * MergedMetadata merged = result.merged();
 *
 * OverrideResult edited = reconciler.override(result,
 *     List.of(FieldPin.of(MetadataField.ALBUM, Provider.DISCOGS)));
 * </pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class MetadataReconciler {
    private static final Logger log = LoggerFactory.getLogger(MetadataReconciler.class);

    private final ReconciliationOptions options;
    private final SourceNormalizer normalizer;
    private final MergeEngine mergeEngine;
    private final OverrideApplier overrideApplier;
    private final ReconciliationCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private MetadataReconciler(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();

        PayloadFieldExtractor fieldExtractor = new PayloadFieldExtractor(
                options.getMinValidYear(), options.getMaxValidYear(), options.isSplitYouTubeArtistTitle());
        this.normalizer = new SourceNormalizer(fieldExtractor,
                new ConfidenceRules(normalizationEngine, new JaccardSimilarity()));

        CorroborationDetector corroborationDetector = new CorroborationDetector(
                normalizationEngine, options.getCorroborationBonus(), options.getYearTolerance());
        this.mergeEngine = new MergeEngine(new RecordScorer(options.getScoringWeights()), corroborationDetector);
        this.overrideApplier = new OverrideApplier(mergeEngine);

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.isCachingEnabled()) {
            this.cache = new CaffeineReconciliationCache(
                    new CacheConfig(options.getCacheMaxSize(), options.getCacheTtlSeconds()));
        } else {
            this.cache = new NoOpReconciliationCache();
        }

        log.info("reconciler.initialized weights={} bonus={} yearTolerance={} caching={}",
                options.getScoringWeights(), options.getCorroborationBonus(), options.getYearTolerance(),
                !(cache instanceof NoOpReconciliationCache));
    }

    // ========== Normalization ==========

    /**
     * Normalizes provider payloads into source records. Unusable payloads are
     * dropped and listed in the batch.
     */
    public NormalizationBatch normalize(TrackQuery query, Collection<ProviderPayload> payloads) {
        NormalizationBatch batch = normalizer.normalizeAll(payloads, query);
        for (NormalizationBatch.RejectedPayload rejected : batch.rejected()) {
            metricsService.incrementInvalidRecord(rejected.providerTag());
        }
        return batch;
    }

    // ========== Merge ==========

    /**
     * Normalizes the payloads and merges the usable records.
     *
     * @throws NoMetadataAvailableException if no payload yields a usable record
     */
    public ReconciliationResult reconcile(TrackQuery query, Collection<ProviderPayload> payloads) {
        Objects.requireNonNull(payloads, "payloads is required");
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forReconciliation(correlationId, query);
             Span span = tracingService.startSpan(TracingService.RECONCILE_SPAN,
                     Map.of("correlationId", correlationId))) {
            span.setAttribute("payloads", payloads.size());
            try {
                NormalizationBatch batch = normalize(query, payloads);
                span.setAttribute("records", batch.records().size());
                span.setAttribute("rejected", batch.rejected().size());

                MergedMetadata merged = mergeRecords(batch.records());
                span.setAttribute("mergeConfidence", merged.getMergeConfidence());
                span.setStatus(Span.SpanStatus.OK);

                log.info("reconcile.completed records={} rejected={} mergeConfidence={}",
                        batch.records().size(), batch.rejected().size(), merged.getMergeConfidence());
                return new ReconciliationResult(correlationId, merged, batch.records(), batch.rejected());
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    /**
     * Merges already-normalized records, consulting the cache first.
     *
     * @throws NoMetadataAvailableException if there are no records
     * @throws IllegalArgumentException if two records come from the same provider
     */
    public MergedMetadata merge(Collection<SourceRecord> records) {
        Objects.requireNonNull(records, "records is required");
        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId())) {
            MergedMetadata merged = mergeRecords(records);
            log.info("merge.completed records={} mergeConfidence={}", records.size(), merged.getMergeConfidence());
            return merged;
        }
    }

    /**
     * Like {@link #merge(Collection)} but returns {@link MergedMetadata#empty()}
     * when there are no records, for callers that fall back to manual entry.
     */
    public MergedMetadata mergeOrEmpty(Collection<SourceRecord> records) {
        try {
            return merge(records);
        } catch (NoMetadataAvailableException e) {
            log.info("merge.empty reason={}", e.getMessage());
            return MergedMetadata.empty();
        }
    }

    private MergedMetadata mergeRecords(Collection<SourceRecord> records) {
        if (records.isEmpty()) {
            metricsService.incrementNoMetadataAvailable();
            log.warn("merge.unavailable no usable source records");
            throw new NoMetadataAvailableException();
        }

        String fingerprint = RecordSetFingerprint.of(records);
        Optional<MergedMetadata> cached = cache.get(fingerprint);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("merge.cache.hit fingerprint={}", fingerprint);
            return cached.get();
        }
        metricsService.recordCacheMiss();

        long start = System.nanoTime();
        MergedMetadata merged = mergeEngine.merge(records);
        metricsService.recordMergeDuration(records.size(), Duration.ofNanos(System.nanoTime() - start));
        metricsService.recordMergeConfidence(merged.getMergeConfidence());
        for (FieldResolution resolution : merged.getFields().values()) {
            if (resolution.corroborated()) {
                metricsService.incrementFieldCorroborated(resolution.field());
            }
        }

        cache.put(fingerprint, merged);
        return merged;
    }

    // ========== Overrides ==========

    /**
     * Pins fields of a reconciliation to caller-chosen providers.
     */
    public OverrideResult override(ReconciliationResult result, Collection<FieldPin> pins) {
        Objects.requireNonNull(result, "result is required");
        return override(result.merged(), result.records(), pins);
    }

    /**
     * Pins fields of a prior merge to caller-chosen providers. Pins the
     * provider cannot satisfy are reported in the result, not thrown.
     *
     * @throws IllegalArgumentException if two pins name different providers for one field
     */
    public OverrideResult override(MergedMetadata prior, Collection<SourceRecord> records,
                                   Collection<FieldPin> pins) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forOverride(correlationId);
             Span span = tracingService.startSpan(TracingService.OVERRIDE_SPAN,
                     Map.of("correlationId", correlationId))) {
            span.setAttribute("pins", pins.size());
            try {
                OverrideResult result = overrideApplier.apply(prior, records, pins);

                List<RejectedOverride> rejected = result.rejected();
                for (FieldPin pin : pins) {
                    boolean wasRejected = rejected.stream().anyMatch(r -> r.pin().equals(pin));
                    if (wasRejected) {
                        metricsService.incrementOverrideRejected(pin.field(), pin.provider());
                    } else {
                        metricsService.incrementOverrideApplied(pin.field(), pin.provider());
                    }
                }

                span.setAttribute("rejected", rejected.size());
                span.setStatus(Span.SpanStatus.OK);
                log.info("override.completed pins={} rejected={} mergeConfidence={}",
                        pins.size(), rejected.size(), result.merged().getMergeConfidence());
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    // ========== Accessors ==========

    public ReconciliationOptions getOptions() {
        return options;
    }

    public ReconciliationCache getCache() {
        return cache;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MetadataReconciler}. Every collaborator is optional.
     */
    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private NormalizationEngine normalizationEngine;
        private ReconciliationCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(ReconciliationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets a custom text normalization engine, used for match checks and corroboration.
         */
        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the merge cache. Overrides {@link ReconciliationOptions#isCachingEnabled()}.
         */
        public Builder cache(ReconciliationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public MetadataReconciler build() {
            return new MetadataReconciler(this);
        }
    }
}
