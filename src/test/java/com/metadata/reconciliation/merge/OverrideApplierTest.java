package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.model.FieldPin;
import com.metadata.reconciliation.core.model.FieldResolution;
import com.metadata.reconciliation.core.model.MergedMetadata;
import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SelectionMode;
import com.metadata.reconciliation.core.model.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OverrideApplier Tests")
class OverrideApplierTest {

    private final MergeEngine engine = new MergeEngine();
    private final OverrideApplier applier = new OverrideApplier(engine);

    private List<SourceRecord> records;
    private MergedMetadata automatic;

    @BeforeEach
    void setUp() {
        records = List.of(
                SourceRecord.builder().provider(Provider.MUSICBRAINZ).confidence(0.95)
                        .title("Bohemian Rhapsody").artist("Queen").album("A Night at the Opera")
                        .year(1975).durationSeconds(354).build(),
                SourceRecord.builder().provider(Provider.SPOTIFY).confidence(0.85)
                        .title("Bohemian Rhapsody - Remastered 2011").artist("Queen")
                        .album("A Night At The Opera (2011 Remaster)").year(1975).build(),
                SourceRecord.builder().provider(Provider.YOUTUBE).confidence(0.6)
                        .title("Queen - Bohemian Rhapsody (Official Video)").artist("Queen Official").build());
        automatic = engine.merge(records);
    }

    @Nested
    @DisplayName("Applied pins")
    class AppliedTests {

        @Test
        @DisplayName("Pinned field takes the provider's literal value")
        void testPinApplied() {
            OverrideResult result = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.ALBUM, Provider.SPOTIFY)));

            FieldResolution album = result.merged().get(MetadataField.ALBUM);
            assertFalse(result.hasRejections());
            assertEquals("A Night At The Opera (2011 Remaster)", album.selectedValue());
            assertEquals(Provider.SPOTIFY, album.winningProvider());
            assertEquals(SelectionMode.OVERRIDE, album.selectionMode());
            assertEquals(automatic.get(MetadataField.ALBUM).alternates(), album.alternates());
        }

        @Test
        @DisplayName("Unpinned fields keep their prior resolution")
        void testOtherFieldsUntouched() {
            MergedMetadata overridden = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.TITLE, Provider.YOUTUBE))).merged();

            for (MetadataField field : MetadataField.values()) {
                if (field != MetadataField.TITLE) {
                    assertEquals(automatic.get(field), overridden.get(field), field.name());
                }
            }
            assertEquals("Queen - Bohemian Rhapsody (Official Video)", overridden.getTitle());
        }

        @Test
        @DisplayName("Merge confidence follows the selected candidates")
        void testMergeConfidenceRecomputed() {
            MergedMetadata overridden = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.TITLE, Provider.YOUTUBE))).merged();

            assertTrue(overridden.getMergeConfidence() < automatic.getMergeConfidence());
        }

        @Test
        @DisplayName("Applying the same pins twice gives the same result")
        void testIdempotent() {
            List<FieldPin> pins = List.of(
                    FieldPin.of(MetadataField.ALBUM, Provider.SPOTIFY),
                    FieldPin.of(MetadataField.ARTIST, Provider.YOUTUBE));

            MergedMetadata once = applier.apply(automatic, records, pins).merged();
            MergedMetadata twice = applier.apply(once, records, pins).merged();

            assertEquals(once, twice);
        }

        @Test
        @DisplayName("Pinning the automatic winner keeps its value")
        void testPinWinner() {
            MergedMetadata overridden = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.YEAR, Provider.MUSICBRAINZ))).merged();

            assertEquals(automatic.getYear(), overridden.getYear());
            assertEquals(SelectionMode.OVERRIDE, overridden.get(MetadataField.YEAR).selectionMode());
            assertTrue(overridden.get(MetadataField.YEAR).corroborated());
        }

        @Test
        @DisplayName("No pins leaves the merge unchanged")
        void testNoPins() {
            assertEquals(automatic, applier.apply(automatic, records, List.of()).merged());
        }
    }

    @Nested
    @DisplayName("Rejected pins")
    class RejectedTests {

        @Test
        @DisplayName("Provider without a value for the field is rejected")
        void testProviderLacksField() {
            FieldPin pin = FieldPin.of(MetadataField.ALBUM, Provider.YOUTUBE);

            OverrideResult result = applier.apply(automatic, records, List.of(pin));

            assertTrue(result.hasRejections());
            assertEquals(pin, result.rejected().get(0).pin());
            assertEquals(automatic.get(MetadataField.ALBUM), result.merged().get(MetadataField.ALBUM));
        }

        @Test
        @DisplayName("Provider with no record is rejected")
        void testProviderWithoutRecord() {
            OverrideResult result = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.GENRE, Provider.LASTFM)));

            assertEquals(1, result.rejected().size());
            assertNull(result.merged().getGenre());
        }

        @Test
        @DisplayName("Rejected pins do not block the others")
        void testMixedPins() {
            OverrideResult result = applier.apply(automatic, records, List.of(
                    FieldPin.of(MetadataField.ALBUM, Provider.YOUTUBE),
                    FieldPin.of(MetadataField.TITLE, Provider.SPOTIFY)));

            assertEquals(1, result.rejected().size());
            assertEquals("Bohemian Rhapsody - Remastered 2011", result.merged().getTitle());
        }

        @Test
        @DisplayName("throwIfRejected raises for rejected pins")
        void testThrowIfRejected() {
            OverrideResult result = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.DURATION, Provider.SPOTIFY)));

            OverrideNotApplicableException e = assertThrows(OverrideNotApplicableException.class,
                    result::throwIfRejected);
            assertEquals(1, e.getRejected().size());
            assertTrue(e.getMessage().contains("duration"));
        }

        @Test
        @DisplayName("throwIfRejected returns the merge when every pin applied")
        void testThrowIfRejectedPasses() {
            OverrideResult result = applier.apply(automatic, records,
                    List.of(FieldPin.of(MetadataField.DURATION, Provider.MUSICBRAINZ)));

            assertEquals(result.merged(), result.throwIfRejected());
        }

        @Test
        @DisplayName("Conflicting pins on one field are a contract violation")
        void testConflictingPins() {
            List<FieldPin> pins = List.of(
                    FieldPin.of(MetadataField.TITLE, Provider.SPOTIFY),
                    FieldPin.of(MetadataField.TITLE, Provider.YOUTUBE));

            assertThrows(IllegalArgumentException.class, () -> applier.apply(automatic, records, pins));
        }

        @Test
        @DisplayName("Repeating the same pin is allowed")
        void testRepeatedPin() {
            List<FieldPin> pins = List.of(
                    FieldPin.of(MetadataField.TITLE, Provider.SPOTIFY),
                    FieldPin.of(MetadataField.TITLE, Provider.SPOTIFY));

            assertFalse(applier.apply(automatic, records, pins).hasRejections());
        }
    }
}
