package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.core.model.TrackQuery;
import com.metadata.reconciliation.rules.DefaultNormalizationRules;
import com.metadata.reconciliation.rules.NormalizationEngine;
import com.metadata.reconciliation.similarity.JaccardSimilarity;
import com.metadata.reconciliation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-specific confidence formulas, held as a lookup table keyed by provider.
 *
 * <table>
 *   <caption>Confidence by provider</caption>
 *   <tr><th>Provider</th><th>Confidence</th></tr>
 *   <tr><td>MusicBrainz</td><td>search score / 100, clamped; 0.0 when the payload has no score</td></tr>
 *   <tr><td>Discogs</td><td>0.9 on an exact normalized (title, artist) match, else 0.7</td></tr>
 *   <tr><td>Spotify</td><td>0.85 on an exact normalized match, else 0.65</td></tr>
 *   <tr><td>Last.fm</td><td>0.75</td></tr>
 *   <tr><td>Genius</td><td>0.7</td></tr>
 *   <tr><td>YouTube</td><td>token overlap of query and video title, at most 0.6</td></tr>
 * </table>
 */
public class ConfidenceRules {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceRules.class);

    public static final String MUSICBRAINZ_SCORE_KEY = "score";

    public static final double DISCOGS_EXACT_MATCH = 0.9;
    public static final double DISCOGS_OTHERWISE = 0.7;
    public static final double SPOTIFY_EXACT_MATCH = 0.85;
    public static final double SPOTIFY_OTHERWISE = 0.65;
    public static final double LASTFM_FIXED = 0.75;
    public static final double GENIUS_FIXED = 0.7;
    public static final double YOUTUBE_CAP = 0.6;

    private final NormalizationEngine normalizationEngine;
    private final SimilarityAlgorithm titleSimilarity;
    private final Map<Provider, ConfidenceRule> rules;

    public ConfidenceRules() {
        this(DefaultNormalizationRules.createDefaultEngine(), new JaccardSimilarity());
    }

    public ConfidenceRules(NormalizationEngine normalizationEngine, SimilarityAlgorithm titleSimilarity) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.titleSimilarity = Objects.requireNonNull(titleSimilarity, "titleSimilarity is required");

        EnumMap<Provider, ConfidenceRule> table = new EnumMap<>(Provider.class);
        table.put(Provider.MUSICBRAINZ, this::musicBrainzConfidence);
        table.put(Provider.DISCOGS, exactMatchRule(DISCOGS_EXACT_MATCH, DISCOGS_OTHERWISE));
        table.put(Provider.SPOTIFY, exactMatchRule(SPOTIFY_EXACT_MATCH, SPOTIFY_OTHERWISE));
        table.put(Provider.LASTFM, ConfidenceRule.fixed(LASTFM_FIXED));
        table.put(Provider.GENIUS, ConfidenceRule.fixed(GENIUS_FIXED));
        table.put(Provider.YOUTUBE, this::youTubeConfidence);
        this.rules = Collections.unmodifiableMap(table);
    }

    public ConfidenceRule ruleFor(Provider provider) {
        return rules.get(provider);
    }

    /**
     * Applies the provider's rule and clamps the result to [0,1].
     */
    public double confidence(Provider provider, ProviderPayload payload, SourceRecord record, TrackQuery query) {
        TrackQuery q = query != null ? query : TrackQuery.none();
        double value = rules.get(provider).confidence(payload, record, q);
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * True if both the query's title and artist equal the record's after normalization.
     */
    public boolean isExactMatch(SourceRecord record, TrackQuery query) {
        if (query == null || !query.hasTitleAndArtist()) {
            return false;
        }
        String title = record.getTitle();
        String artist = record.getArtist();
        if (title == null || artist == null) {
            return false;
        }
        return normalizationEngine.areEquivalent(query.title(), title, MetadataField.TITLE)
                && normalizationEngine.areEquivalent(query.artist(), artist, MetadataField.ARTIST);
    }

    private ConfidenceRule exactMatchRule(double exact, double otherwise) {
        return (payload, record, query) -> isExactMatch(record, query) ? exact : otherwise;
    }

    private double musicBrainzConfidence(ProviderPayload payload, SourceRecord record, TrackQuery query) {
        Object score = payload.attribute(MUSICBRAINZ_SCORE_KEY);
        if (score == null) {
            return 0.0;
        }
        double raw;
        if (score instanceof Number number) {
            raw = number.doubleValue();
        } else {
            try {
                raw = Double.parseDouble(score.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("confidence.unparseable provider=MUSICBRAINZ score='{}'", score);
                return 0.0;
            }
        }
        return raw / 100.0;
    }

    private double youTubeConfidence(ProviderPayload payload, SourceRecord record, TrackQuery query) {
        // the unsplit video title, even when artist and title were split out of it
        Object rawTitle = payload.attribute("title");
        String videoTitle = rawTitle instanceof String s && !s.isBlank() ? s : record.getTitle();
        if (videoTitle == null) {
            return 0.0;
        }
        String normalizedQuery = normalizationEngine.normalize(query.asSearchString());
        String normalizedTitle = normalizationEngine.normalize(videoTitle, MetadataField.TITLE);
        return titleSimilarity.computeCapped(normalizedQuery, normalizedTitle, YOUTUBE_CAP);
    }
}
