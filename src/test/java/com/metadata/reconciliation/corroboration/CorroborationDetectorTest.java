package com.metadata.reconciliation.corroboration;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.SourceRecord;
import com.metadata.reconciliation.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorroborationDetector Tests")
class CorroborationDetectorTest {

    private final CorroborationDetector detector = new CorroborationDetector();

    private static SourceRecord record(Provider provider, MetadataField field, Object value) {
        return SourceRecord.builder().provider(provider).confidence(0.8).value(field, value).build();
    }

    @Nested
    @DisplayName("Text fields")
    class TextTests {

        @Test
        @DisplayName("Values equal after normalization agree")
        void testNormalizedAgreement() {
            FieldCorroboration result = detector.detect(MetadataField.TITLE, List.of(
                    record(Provider.MUSICBRAINZ, MetadataField.TITLE, "Bohemian Rhapsody"),
                    record(Provider.DISCOGS, MetadataField.TITLE, "BOHEMIAN  RHAPSODY"),
                    record(Provider.YOUTUBE, MetadataField.TITLE, "Queen - Bohemian Rhapsody (Official Video)")));

            assertTrue(result.isCorroborated());
            assertEquals(Set.of(Provider.MUSICBRAINZ, Provider.DISCOGS), result.agreeingProviders());
            assertFalse(result.isAgreeing(Provider.YOUTUBE));
        }

        @Test
        @DisplayName("Different values do not agree")
        void testDisagreement() {
            FieldCorroboration result = detector.detect(MetadataField.ARTIST, List.of(
                    record(Provider.DISCOGS, MetadataField.ARTIST, "Queen"),
                    record(Provider.YOUTUBE, MetadataField.ARTIST, "Queen Official")));

            assertFalse(result.isCorroborated());
            assertTrue(result.agreeingProviders().isEmpty());
        }

        @Test
        @DisplayName("Records without the field are ignored")
        void testMissingField() {
            FieldCorroboration result = detector.detect(MetadataField.ALBUM, List.of(
                    record(Provider.DISCOGS, MetadataField.ALBUM, "A Night at the Opera"),
                    record(Provider.YOUTUBE, MetadataField.TITLE, "A Night at the Opera")));

            assertFalse(result.isCorroborated());
        }
    }

    @Nested
    @DisplayName("Numeric fields")
    class NumericTests {

        @ParameterizedTest
        @DisplayName("Years within tolerance agree")
        @CsvSource({
                "1975,1975,true",
                "1975,1976,true",
                "1976,1975,true",
                "1975,1977,false"
        })
        void testYearTolerance(int year1, int year2, boolean expected) {
            assertEquals(expected, detector.agree(MetadataField.YEAR, year1, year2));
        }

        @Test
        @DisplayName("Year agreement is pairwise")
        void testPairwiseYears() {
            FieldCorroboration result = detector.detect(MetadataField.YEAR, List.of(
                    record(Provider.MUSICBRAINZ, MetadataField.YEAR, 1975),
                    record(Provider.DISCOGS, MetadataField.YEAR, 1976),
                    record(Provider.SPOTIFY, MetadataField.YEAR, 1977)));

            assertEquals(Set.of(Provider.MUSICBRAINZ, Provider.DISCOGS, Provider.SPOTIFY), result.agreeingProviders());
        }

        @Test
        @DisplayName("Zero tolerance requires equal years")
        void testZeroTolerance() {
            CorroborationDetector strict = new CorroborationDetector(
                    DefaultNormalizationRules.createDefaultEngine(), 0.1, 0);

            assertFalse(strict.agree(MetadataField.YEAR, 1975, 1976));
            assertTrue(strict.agree(MetadataField.YEAR, 1975, 1975));
        }

        @Test
        @DisplayName("Durations must be equal")
        void testDuration() {
            assertFalse(detector.agree(MetadataField.DURATION, 354, 355));
            assertTrue(detector.agree(MetadataField.DURATION, 354, 354));
        }
    }

    @Nested
    @DisplayName("Bonus")
    class BonusTests {

        @Test
        @DisplayName("Only agreeing providers receive the bonus")
        void testBonusExclusive() {
            FieldCorroboration result = new FieldCorroboration(MetadataField.TITLE,
                    Set.of(Provider.MUSICBRAINZ, Provider.DISCOGS), 0.1);

            assertEquals(0.6, result.effectiveScore(Provider.DISCOGS, 0.5), 1e-9);
            assertEquals(0.5, result.effectiveScore(Provider.YOUTUBE, 0.5), 1e-9);
        }

        @Test
        @DisplayName("Bonus is capped at 1.0")
        void testBonusCap() {
            FieldCorroboration result = new FieldCorroboration(MetadataField.TITLE,
                    Set.of(Provider.MUSICBRAINZ, Provider.DISCOGS), 0.1);

            assertEquals(1.0, result.effectiveScore(Provider.MUSICBRAINZ, 0.95));
        }

        @Test
        @DisplayName("Invalid bonus and tolerance are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () ->
                    new CorroborationDetector(DefaultNormalizationRules.createDefaultEngine(), 1.5, 1));
            assertThrows(IllegalArgumentException.class, () ->
                    new CorroborationDetector(DefaultNormalizationRules.createDefaultEngine(), 0.1, -1));
        }
    }

    @Test
    @DisplayName("A single record is never corroborated")
    void testSingleRecord() {
        FieldCorroboration result = detector.detect(MetadataField.TITLE, List.of(
                record(Provider.MUSICBRAINZ, MetadataField.TITLE, "Bohemian Rhapsody")));

        assertFalse(result.isCorroborated());
    }

    @Test
    @DisplayName("Null values never agree")
    void testNullValues() {
        assertFalse(detector.agree(MetadataField.TITLE, null, "x"));
    }
}
