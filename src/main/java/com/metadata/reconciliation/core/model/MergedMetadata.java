package com.metadata.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The unified, provenance-tagged record produced for one query.
 * Holds a {@link FieldResolution} for every field of the universal set.
 * Instances are values: overrides produce a new instance.
 */
public final class MergedMetadata {
    private final Map<MetadataField, FieldResolution> fields;
    private final double mergeConfidence;

    private MergedMetadata(Map<MetadataField, FieldResolution> fields) {
        EnumMap<MetadataField, FieldResolution> copy = new EnumMap<>(MetadataField.class);
        for (MetadataField field : MetadataField.values()) {
            FieldResolution resolution = fields.get(field);
            if (resolution != null && resolution.field() != field) {
                throw new IllegalArgumentException("Resolution for " + resolution.field() + " stored under " + field);
            }
            copy.put(field, resolution != null ? resolution : FieldResolution.empty(field));
        }
        this.fields = Collections.unmodifiableMap(copy);
        this.mergeConfidence = computeMergeConfidence(copy);
    }

    /**
     * Builds merged metadata from per-field resolutions. Missing fields are treated as empty.
     */
    public static MergedMetadata of(Map<MetadataField, FieldResolution> resolutions) {
        Objects.requireNonNull(resolutions, "resolutions is required");
        return new MergedMetadata(resolutions);
    }

    /**
     * Merged metadata with every field null, for callers that fall back to manual entry.
     */
    public static MergedMetadata empty() {
        return new MergedMetadata(Map.of());
    }

    /**
     * Mean effective score of the selected candidates, over fields that have one.
     * Fields without a candidate are excluded; 0.0 when no field has a value.
     */
    private static double computeMergeConfidence(Map<MetadataField, FieldResolution> fields) {
        double sum = 0.0;
        int counted = 0;
        for (FieldResolution resolution : fields.values()) {
            Optional<Double> score = resolution.selectedScore();
            if (score.isPresent()) {
                sum += score.get();
                counted++;
            }
        }
        return counted == 0 ? 0.0 : Math.min(1.0, sum / counted);
    }

    public FieldResolution get(MetadataField field) {
        return fields.get(field);
    }

    /**
     * All field resolutions in field order.
     */
    public Map<MetadataField, FieldResolution> getFields() {
        return fields;
    }

    public double getMergeConfidence() {
        return mergeConfidence;
    }

    public boolean isEmpty() {
        return fields.values().stream().noneMatch(FieldResolution::hasValue);
    }

    public Object getValue(MetadataField field) {
        return fields.get(field).selectedValue();
    }

    public Optional<Provider> getWinningProvider(MetadataField field) {
        return Optional.ofNullable(fields.get(field).winningProvider());
    }

    public String getTitle() {
        return (String) getValue(MetadataField.TITLE);
    }

    public String getArtist() {
        return (String) getValue(MetadataField.ARTIST);
    }

    public String getAlbum() {
        return (String) getValue(MetadataField.ALBUM);
    }

    public Integer getYear() {
        return (Integer) getValue(MetadataField.YEAR);
    }

    public String getGenre() {
        return (String) getValue(MetadataField.GENRE);
    }

    public Integer getDurationSeconds() {
        return (Integer) getValue(MetadataField.DURATION);
    }

    public String getCoverArtUrl() {
        return (String) getValue(MetadataField.COVER_ART_URL);
    }

    /**
     * Returns a copy with one field's resolution replaced.
     */
    public MergedMetadata withField(FieldResolution resolution) {
        EnumMap<MetadataField, FieldResolution> copy = new EnumMap<>(fields);
        copy.put(resolution.field(), resolution);
        return new MergedMetadata(copy);
    }

    /**
     * Describes the merge as nested maps and lists, keyed by field key, for
     * display layers that list alternates before prompting for overrides.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("merge_confidence", mergeConfidence);
        Map<String, Object> fieldSummaries = new LinkedHashMap<>();
        for (FieldResolution resolution : fields.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", resolution.selectedValue());
            entry.put("provider", resolution.winningProvider() != null
                    ? resolution.winningProvider().getDisplayName() : null);
            entry.put("corroborated", resolution.corroborated());
            entry.put("selection", resolution.selectionMode().name());
            List<Map<String, Object>> alternates = new ArrayList<>();
            for (Candidate candidate : resolution.alternates()) {
                Map<String, Object> alt = new LinkedHashMap<>();
                alt.put("provider", candidate.provider().getDisplayName());
                alt.put("value", candidate.value());
                alt.put("score", candidate.effectiveScore());
                alternates.add(alt);
            }
            entry.put("alternates", alternates);
            fieldSummaries.put(resolution.field().getKey(), entry);
        }
        summary.put("fields", fieldSummaries);
        return summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergedMetadata that = (MergedMetadata) o;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MergedMetadata{");
        for (FieldResolution resolution : fields.values()) {
            sb.append(resolution.field().getKey()).append('=').append(resolution.selectedValue());
            if (resolution.winningProvider() != null) {
                sb.append(" (").append(resolution.winningProvider().getDisplayName()).append(')');
            }
            sb.append(", ");
        }
        sb.append("mergeConfidence=").append(String.format("%.4f", mergeConfidence)).append('}');
        return sb.toString();
    }
}
