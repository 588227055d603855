package com.metadata.reconciliation.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One provider's normalized description of a candidate track.
 * Immutable once built. Blank strings are stored as absent values, so every
 * value returned by {@link #getValue(MetadataField)} is non-empty.
 */
public final class SourceRecord {
    private final Provider provider;
    private final Map<MetadataField, Object> values;
    private final double confidence;
    private final double completeness;

    private SourceRecord(Builder builder) {
        this.provider = Objects.requireNonNull(builder.provider, "provider is required");
        if (Double.isNaN(builder.confidence) || builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + builder.confidence);
        }
        EnumMap<MetadataField, Object> copy = new EnumMap<>(MetadataField.class);
        copy.putAll(builder.values);
        this.values = Collections.unmodifiableMap(copy);
        this.confidence = builder.confidence;
        this.completeness = (double) copy.size() / MetadataField.count();
    }

    public Provider getProvider() {
        return provider;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Fraction of the universal field set this record populates.
     */
    public double getCompleteness() {
        return completeness;
    }

    /**
     * Returns the literal value for a field, or null when the provider supplied none.
     */
    public Object getValue(MetadataField field) {
        return values.get(field);
    }

    public boolean hasValue(MetadataField field) {
        return values.containsKey(field);
    }

    /**
     * Populated fields only, in field order.
     */
    public Map<MetadataField, Object> getValues() {
        return values;
    }

    public String getTitle() {
        return (String) values.get(MetadataField.TITLE);
    }

    public String getArtist() {
        return (String) values.get(MetadataField.ARTIST);
    }

    public String getAlbum() {
        return (String) values.get(MetadataField.ALBUM);
    }

    public Optional<Integer> getYear() {
        return Optional.ofNullable((Integer) values.get(MetadataField.YEAR));
    }

    public String getGenre() {
        return (String) values.get(MetadataField.GENRE);
    }

    public Optional<Integer> getDurationSeconds() {
        return Optional.ofNullable((Integer) values.get(MetadataField.DURATION));
    }

    public String getCoverArtUrl() {
        return (String) values.get(MetadataField.COVER_ART_URL);
    }

    /**
     * Returns a builder pre-filled with this record's provider and values.
     */
    public Builder toBuilder() {
        Builder builder = builder().provider(provider).confidence(confidence);
        values.forEach(builder::value);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return Double.compare(that.confidence, confidence) == 0
                && provider == that.provider
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, values, confidence);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "provider=" + provider +
                ", confidence=" + confidence +
                ", completeness=" + completeness +
                ", values=" + values +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Provider provider;
        private final Map<MetadataField, Object> values = new EnumMap<>(MetadataField.class);
        private double confidence;

        public Builder provider(Provider provider) {
            this.provider = provider;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        /**
         * Sets a field value. Null and blank strings clear the field.
         *
         * @throws IllegalArgumentException if the value does not match the field's type
         */
        public Builder value(MetadataField field, Object value) {
            Objects.requireNonNull(field, "field is required");
            if (value == null || (value instanceof String s && s.isBlank())) {
                values.remove(field);
                return this;
            }
            if (!field.getValueType().isInstance(value)) {
                throw new IllegalArgumentException("Field " + field + " expects "
                        + field.getValueType().getSimpleName() + " but got "
                        + value.getClass().getSimpleName());
            }
            values.put(field, value);
            return this;
        }

        public Builder title(String title) {
            return value(MetadataField.TITLE, title);
        }

        public Builder artist(String artist) {
            return value(MetadataField.ARTIST, artist);
        }

        public Builder album(String album) {
            return value(MetadataField.ALBUM, album);
        }

        public Builder year(Integer year) {
            return value(MetadataField.YEAR, year);
        }

        public Builder genre(String genre) {
            return value(MetadataField.GENRE, genre);
        }

        public Builder durationSeconds(Integer durationSeconds) {
            return value(MetadataField.DURATION, durationSeconds);
        }

        public Builder coverArtUrl(String coverArtUrl) {
            return value(MetadataField.COVER_ART_URL, coverArtUrl);
        }

        public SourceRecord build() {
            return new SourceRecord(this);
        }
    }
}
