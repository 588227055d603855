package com.metadata.reconciliation.api;

import com.metadata.reconciliation.scoring.ScoringWeights;

/**
 * Options for metadata reconciliation.
 * Holds the scoring knobs (weights and corroboration bonus), the value
 * validation bounds used during normalization, and merge cache settings.
 */
public class ReconciliationOptions {

    private static final double DEFAULT_CORROBORATION_BONUS = 0.1;
    private static final int DEFAULT_YEAR_TOLERANCE = 1;
    private static final int DEFAULT_MIN_VALID_YEAR = 1900;
    private static final int DEFAULT_MAX_VALID_YEAR = 2030;
    private static final int DEFAULT_CACHE_MAX_SIZE = 1_000;
    private static final int DEFAULT_CACHE_TTL_SECONDS = 300;

    private final ScoringWeights scoringWeights;
    private final double corroborationBonus;
    private final int yearTolerance;
    private final int minValidYear;
    private final int maxValidYear;
    private final boolean splitYouTubeArtistTitle;
    private final boolean cachingEnabled;
    private final int cacheMaxSize;
    private final int cacheTtlSeconds;

    private ReconciliationOptions(Builder builder) {
        this.scoringWeights = builder.scoringWeights;
        this.corroborationBonus = builder.corroborationBonus;
        this.yearTolerance = builder.yearTolerance;
        this.minValidYear = builder.minValidYear;
        this.maxValidYear = builder.maxValidYear;
        this.splitYouTubeArtistTitle = builder.splitYouTubeArtistTitle;
        this.cachingEnabled = builder.cachingEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheTtlSeconds = builder.cacheTtlSeconds;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    /**
     * Additive bonus for candidates whose value another provider agrees with.
     */
    public double getCorroborationBonus() {
        return corroborationBonus;
    }

    /**
     * Maximum difference between two years still treated as agreement.
     */
    public int getYearTolerance() {
        return yearTolerance;
    }

    public int getMinValidYear() {
        return minValidYear;
    }

    public int getMaxValidYear() {
        return maxValidYear;
    }

    /**
     * Whether YouTube titles of the form "Artist - Title" are split into both fields.
     */
    public boolean isSplitYouTubeArtistTitle() {
        return splitYouTubeArtistTitle;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private double corroborationBonus = DEFAULT_CORROBORATION_BONUS;
        private int yearTolerance = DEFAULT_YEAR_TOLERANCE;
        private int minValidYear = DEFAULT_MIN_VALID_YEAR;
        private int maxValidYear = DEFAULT_MAX_VALID_YEAR;
        private boolean splitYouTubeArtistTitle = false;
        private boolean cachingEnabled = false;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private int cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights must not be null");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder scoringWeights(double confidenceWeight, double completenessWeight) {
            return scoringWeights(new ScoringWeights(confidenceWeight, completenessWeight));
        }

        public Builder corroborationBonus(double corroborationBonus) {
            if (corroborationBonus < 0.0 || corroborationBonus > 1.0) {
                throw new IllegalArgumentException("corroborationBonus must be between 0.0 and 1.0");
            }
            this.corroborationBonus = corroborationBonus;
            return this;
        }

        public Builder yearTolerance(int yearTolerance) {
            if (yearTolerance < 0) {
                throw new IllegalArgumentException("yearTolerance must not be negative");
            }
            this.yearTolerance = yearTolerance;
            return this;
        }

        public Builder validYearRange(int minValidYear, int maxValidYear) {
            this.minValidYear = minValidYear;
            this.maxValidYear = maxValidYear;
            return this;
        }

        public Builder splitYouTubeArtistTitle(boolean splitYouTubeArtistTitle) {
            this.splitYouTubeArtistTitle = splitYouTubeArtistTitle;
            return this;
        }

        public Builder cachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be positive");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            if (cacheTtlSeconds <= 0) {
                throw new IllegalArgumentException("cacheTtlSeconds must be positive");
            }
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public ReconciliationOptions build() {
            if (minValidYear > maxValidYear) {
                throw new IllegalArgumentException("minValidYear must be <= maxValidYear");
            }
            return new ReconciliationOptions(this);
        }
    }
}
