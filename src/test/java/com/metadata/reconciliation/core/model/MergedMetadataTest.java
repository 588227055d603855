package com.metadata.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MergedMetadataTest {

    private static FieldResolution resolved(MetadataField field, Object value, Provider provider, double score) {
        return new FieldResolution(field, value, provider,
                List.of(new Candidate(provider, value, score, false)), false, SelectionMode.AUTOMATIC);
    }

    @Test
    @DisplayName("Empty metadata has every field null and zero confidence")
    void testEmpty() {
        MergedMetadata empty = MergedMetadata.empty();

        assertTrue(empty.isEmpty());
        assertEquals(0.0, empty.getMergeConfidence());
        assertEquals(MetadataField.count(), empty.getFields().size());
        for (FieldResolution resolution : empty.getFields().values()) {
            assertNull(resolution.selectedValue());
            assertEquals(SelectionMode.NONE, resolution.selectionMode());
        }
    }

    @Test
    @DisplayName("Merge confidence averages only fields that have a value")
    void testMergeConfidence() {
        Map<MetadataField, FieldResolution> fields = new EnumMap<>(MetadataField.class);
        fields.put(MetadataField.TITLE, resolved(MetadataField.TITLE, "Bohemian Rhapsody", Provider.MUSICBRAINZ, 0.9));
        fields.put(MetadataField.YEAR, resolved(MetadataField.YEAR, 1975, Provider.DISCOGS, 0.6));

        MergedMetadata merged = MergedMetadata.of(fields);

        assertEquals(0.75, merged.getMergeConfidence(), 1e-9);
        assertEquals("Bohemian Rhapsody", merged.getTitle());
        assertEquals(1975, merged.getYear());
        assertNull(merged.getAlbum());
        assertEquals(Provider.DISCOGS, merged.getWinningProvider(MetadataField.YEAR).orElseThrow());
    }

    @Test
    @DisplayName("withField returns a new instance and leaves the original untouched")
    void testWithField() {
        MergedMetadata original = MergedMetadata.empty();
        MergedMetadata changed = original.withField(
                resolved(MetadataField.GENRE, "Rock", Provider.LASTFM, 0.5));

        assertNull(original.getGenre());
        assertEquals("Rock", changed.getGenre());
        assertNotEquals(original, changed);
    }

    @Test
    @DisplayName("Resolution stored under the wrong field is rejected")
    void testMismatchedField() {
        Map<MetadataField, FieldResolution> fields = new EnumMap<>(MetadataField.class);
        fields.put(MetadataField.TITLE, resolved(MetadataField.ALBUM, "A Night at the Opera", Provider.DISCOGS, 0.8));

        assertThrows(IllegalArgumentException.class, () -> MergedMetadata.of(fields));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Summary lists every field with provenance and alternates")
    void testSummary() {
        MergedMetadata merged = MergedMetadata.empty()
                .withField(resolved(MetadataField.TITLE, "Bohemian Rhapsody", Provider.MUSICBRAINZ, 0.9));

        Map<String, Object> summary = merged.toSummary();
        Map<String, Object> fields = (Map<String, Object>) summary.get("fields");
        Map<String, Object> title = (Map<String, Object>) fields.get("title");

        assertEquals(0.9, (double) summary.get("merge_confidence"), 1e-9);
        assertEquals(List.of("title", "artist", "album", "year", "genre", "duration", "cover_art_url"),
                List.copyOf(fields.keySet()));
        assertEquals("Bohemian Rhapsody", title.get("value"));
        assertEquals("MusicBrainz", title.get("provider"));
        assertEquals("AUTOMATIC", title.get("selection"));
        assertEquals(1, ((List<?>) title.get("alternates")).size());
    }

    @Test
    @DisplayName("Selected value and winning provider must both be present or both absent")
    void testResolutionConsistency() {
        assertThrows(IllegalArgumentException.class, () ->
                new FieldResolution(MetadataField.TITLE, "x", null, List.of(), false, SelectionMode.AUTOMATIC));
        assertThrows(IllegalArgumentException.class, () ->
                new FieldResolution(MetadataField.TITLE, null, Provider.SPOTIFY, List.of(), false, SelectionMode.AUTOMATIC));
    }
}
