package com.metadata.reconciliation.api;

import com.metadata.reconciliation.core.model.FieldPin;
import com.metadata.reconciliation.core.model.FieldResolution;
import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SelectionMode;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.core.model.TrackQuery;
import com.metadata.reconciliation.merge.OverrideNotApplicableException;
import com.metadata.reconciliation.merge.OverrideResult;
import com.metadata.reconciliation.scoring.RecordScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reconciliation of provider payloads for a single search.
 */
@DisplayName("Reconciliation scenarios")
class ScenarioTest {

    private static final TrackQuery QUERY = TrackQuery.of("Bohemian Rhapsody", "Queen");

    private final MetadataReconciler reconciler = MetadataReconciler.builder().build();
    private final RecordScorer scorer = new RecordScorer();

    private static List<ProviderPayload> queenPayloads() {
        return List.of(
                new ProviderPayload("musicbrainz", Map.of(
                        "score", 95,
                        "title", "Bohemian Rhapsody",
                        "artist", "Queen",
                        "album", "A Night at the Opera",
                        "first_release_date", "1975-10-31",
                        "genre", "Rock",
                        "length", 354000)),
                new ProviderPayload("discogs", Map.of(
                        "title", "Bohemian Rhapsody",
                        "artist", "Queen",
                        "album", "A Night At The Opera",
                        "year", 1975,
                        "cover_image", "https://img.discogs.com/opera.jpg")),
                new ProviderPayload("youtube", Map.of(
                        "title", "Queen - Bohemian Rhapsody (Official Video)",
                        "channel", "Queen Official",
                        "thumbnail", "https://i.ytimg.com/vi/fJ9rUzIMcZQ/hqdefault.jpg")));
    }

    @Test
    @DisplayName("MusicBrainz, Discogs and YouTube merge with corroborated year")
    void testQueenMerge() {
        ReconciliationResult result = reconciler.reconcile(QUERY, queenPayloads());
        MergedMetadata merged = result.merged();

        assertFalse(result.hasRejections());
        assertEquals(3, result.records().size());

        assertEquals("Bohemian Rhapsody", merged.getTitle());
        assertEquals(Provider.MUSICBRAINZ, merged.get(MetadataField.TITLE).winningProvider());
        assertEquals("Queen", merged.getArtist());
        assertEquals(Provider.MUSICBRAINZ, merged.get(MetadataField.ARTIST).winningProvider());
        assertEquals("A Night at the Opera", merged.getAlbum());
        assertEquals(Provider.MUSICBRAINZ, merged.get(MetadataField.ALBUM).winningProvider());

        FieldResolution year = merged.get(MetadataField.YEAR);
        assertEquals(1975, year.selectedValue());
        assertTrue(year.corroborated());

        assertEquals(354, merged.getDurationSeconds());
        assertEquals("https://img.discogs.com/opera.jpg", merged.getCoverArtUrl());
        assertEquals(Provider.DISCOGS, merged.get(MetadataField.COVER_ART_URL).winningProvider());

        SourceRecord youtube = result.records().stream()
                .filter(r -> r.getProvider() == Provider.YOUTUBE).findFirst().orElseThrow();
        assertEquals(0.6, youtube.getConfidence(), 1e-9);
        assertEquals(scorer.score(youtube),
                merged.get(MetadataField.TITLE).candidateFrom(Provider.YOUTUBE).orElseThrow().effectiveScore(), 1e-9);

        assertTrue(merged.getMergeConfidence() > 0.9 && merged.getMergeConfidence() <= 1.0);
    }

    @Test
    @DisplayName("Only YouTube answered and it has no year")
    void testYouTubeOnly() {
        ReconciliationResult result = reconciler.reconcile(QUERY, List.of(
                new ProviderPayload("youtube", Map.of(
                        "title", "Queen - Bohemian Rhapsody (Official Video)",
                        "channel", "Queen Official"))));
        MergedMetadata merged = result.merged();

        assertNull(merged.getYear());
        assertEquals(SelectionMode.NONE, merged.get(MetadataField.YEAR).selectionMode());
        assertEquals("Queen - Bohemian Rhapsody (Official Video)", merged.getTitle());
        assertEquals(Provider.YOUTUBE, merged.get(MetadataField.TITLE).winningProvider());
        assertFalse(merged.get(MetadataField.TITLE).corroborated());
    }

    @Test
    @DisplayName("Pinning album to YouTube is rejected and the album is kept")
    void testAlbumPinRejected() {
        ReconciliationResult result = reconciler.reconcile(QUERY, queenPayloads());

        OverrideResult overridden = reconciler.override(result,
                List.of(FieldPin.of(MetadataField.ALBUM, Provider.YOUTUBE)));

        assertTrue(overridden.hasRejections());
        assertEquals("A Night at the Opera", overridden.merged().getAlbum());
        assertEquals(Provider.MUSICBRAINZ, overridden.merged().get(MetadataField.ALBUM).winningProvider());
        assertThrows(OverrideNotApplicableException.class, overridden::throwIfRejected);
    }

    @Test
    @DisplayName("Reconciling the same payloads twice gives equal results")
    void testRepeatable() {
        MergedMetadata first = reconciler.reconcile(QUERY, queenPayloads()).merged();
        List<ProviderPayload> reversed = new ArrayList<>(queenPayloads());
        Collections.reverse(reversed);
        MergedMetadata second = reconciler.reconcile(QUERY, reversed).merged();

        assertEquals(first, second);
    }
}
