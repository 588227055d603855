package com.metadata.reconciliation.cdi;

import com.metadata.reconciliation.api.MetadataReconciler;
import com.metadata.reconciliation.api.ReconciliationOptions;
import com.metadata.reconciliation.source.ProviderPayloadReader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the reconciliation library from MicroProfile Config properties.
 *
 * <p>Every property has a default, so no configuration is required:</p>
 * <pre>
 * metadata-reconciliation:
 *   scoring:
 *     confidence-weight: 0.7
 *     completeness-weight: 0.3
 *   corroboration:
 *     bonus: 0.1
 *     year-tolerance: 1
 *   normalization:
 *     min-valid-year: 1900
 *     max-valid-year: 2030
 *     split-youtube-artist-title: false
 *   cache:
 *     enabled: false
 *     max-size: 1000
 *     ttl-seconds: 300
 * </pre>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Scoring ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.scoring.confidence-weight", defaultValue = "0.7")
    double confidenceWeight;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.scoring.completeness-weight", defaultValue = "0.3")
    double completenessWeight;

    // ── Corroboration ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.corroboration.bonus", defaultValue = "0.1")
    double corroborationBonus;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.corroboration.year-tolerance", defaultValue = "1")
    int yearTolerance;

    // ── Normalization ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.normalization.min-valid-year", defaultValue = "1900")
    int minValidYear;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.normalization.max-valid-year", defaultValue = "2030")
    int maxValidYear;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.normalization.split-youtube-artist-title", defaultValue = "false")
    boolean splitYouTubeArtistTitle;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.cache.enabled", defaultValue = "false")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "metadata-reconciliation.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    ReconciliationOptions options() {
        return ReconciliationOptions.builder()
                .scoringWeights(confidenceWeight, completenessWeight)
                .corroborationBonus(corroborationBonus)
                .yearTolerance(yearTolerance)
                .validYearRange(minValidYear, maxValidYear)
                .splitYouTubeArtistTitle(splitYouTubeArtistTitle)
                .cachingEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtlSeconds(cacheTtlSeconds)
                .build();
    }

    @Produces
    @ApplicationScoped
    public MetadataReconciler metadataReconciler() {
        log.info("Producing MetadataReconciler: weights={}/{} cache={}",
                confidenceWeight, completenessWeight, cacheEnabled);
        return MetadataReconciler.builder()
                .options(options())
                .build();
    }

    @Produces
    @ApplicationScoped
    public ProviderPayloadReader providerPayloadReader() {
        return new ProviderPayloadReader();
    }
}
