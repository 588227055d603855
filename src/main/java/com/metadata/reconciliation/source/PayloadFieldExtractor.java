package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;
import com.metadata.reconciliation.core.model.ProviderPayload;
import com.metadata.reconciliation.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a provider payload's attributes onto the universal field set.
 *
 * <p>Each field is read from the first present attribute among its aliases:
 * the common keys shared by every provider, then the provider's own names
 * (e.g. a YouTube {@code channel} stands in for the artist). Values are
 * converted to the field's type; values that cannot be converted, years
 * outside the valid range and non-positive durations are discarded.</p>
 */
public class PayloadFieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(PayloadFieldExtractor.class);

    private static final Map<MetadataField, List<String>> COMMON_KEYS = commonKeys();
    private static final Map<Provider, Map<MetadataField, List<String>>> PROVIDER_KEYS = providerKeys();

    /** Duration attributes reported in milliseconds rather than seconds. */
    private static final Set<String> MILLISECOND_KEYS = Set.of("duration_ms", "length");

    private static final Pattern LEADING_YEAR = Pattern.compile("^\\s*(\\d{4})");
    private static final Pattern CLOCK_DURATION = Pattern.compile("^\\s*(?:(\\d{1,4}):)?(\\d{1,2}):(\\d{2})\\s*$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^\\s*\\d+(?:\\.\\d+)?\\s*$");
    private static final String YOUTUBE_ARTIST_TITLE_SEPARATOR = " - ";
    private static final int GENRE_TAG_LIMIT = 3;

    private final int minValidYear;
    private final int maxValidYear;
    private final boolean splitYouTubeArtistTitle;

    public PayloadFieldExtractor() {
        this(1900, 2030, false);
    }

    public PayloadFieldExtractor(int minValidYear, int maxValidYear, boolean splitYouTubeArtistTitle) {
        if (minValidYear > maxValidYear) {
            throw new IllegalArgumentException("minValidYear must be <= maxValidYear");
        }
        this.minValidYear = minValidYear;
        this.maxValidYear = maxValidYear;
        this.splitYouTubeArtistTitle = splitYouTubeArtistTitle;
    }

    /**
     * Fills the builder with every field the payload supplies.
     */
    public SourceRecord.Builder extract(Provider provider, ProviderPayload payload) {
        SourceRecord.Builder builder = SourceRecord.builder().provider(provider);
        for (MetadataField field : MetadataField.values()) {
            builder.value(field, extractField(provider, payload, field));
        }
        if (provider == Provider.YOUTUBE && splitYouTubeArtistTitle) {
            splitArtistTitle(payload, builder);
        }
        return builder;
    }

    /**
     * Returns the converted value for one field, or null.
     */
    public Object extractField(Provider provider, ProviderPayload payload, MetadataField field) {
        for (String key : aliases(provider, field)) {
            Object raw = payload.attribute(key);
            if (raw == null) {
                continue;
            }
            Object converted = convert(provider, field, key, raw);
            if (converted != null) {
                return converted;
            }
        }
        return null;
    }

    /**
     * Attribute names consulted for a field, in lookup order.
     */
    public List<String> aliases(Provider provider, MetadataField field) {
        List<String> keys = new ArrayList<>(COMMON_KEYS.getOrDefault(field, List.of()));
        keys.addAll(PROVIDER_KEYS.getOrDefault(provider, Map.of()).getOrDefault(field, List.of()));
        return keys;
    }

    private Object convert(Provider provider, MetadataField field, String key, Object raw) {
        switch (field) {
            case YEAR:
                return toYear(provider, raw);
            case DURATION:
                return toDurationSeconds(provider, key, raw);
            case GENRE:
                return toText(raw, GENRE_TAG_LIMIT);
            default:
                return toText(raw, Integer.MAX_VALUE);
        }
    }

    private String toText(Object raw, int listLimit) {
        if (raw instanceof String s) {
            return s.isBlank() ? null : s;
        }
        if (raw instanceof Collection<?> items) {
            String joined = items.stream()
                    .filter(item -> item instanceof String || item instanceof Number)
                    .map(String::valueOf)
                    .filter(s -> !s.isBlank())
                    .limit(listLimit)
                    .collect(Collectors.joining(", "));
            return joined.isEmpty() ? null : joined;
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return String.valueOf(raw);
        }
        return null;
    }

    private Integer toYear(Provider provider, Object raw) {
        Integer year = null;
        if (raw instanceof Number number) {
            year = number.intValue();
        } else if (raw instanceof String s) {
            Matcher m = LEADING_YEAR.matcher(s);
            if (m.find()) {
                year = Integer.parseInt(m.group(1));
            }
        }
        if (year == null) {
            return null;
        }
        if (year < minValidYear || year > maxValidYear) {
            log.warn("payload.value.discarded provider={} field=YEAR value={} reason=out-of-range", provider, year);
            return null;
        }
        return year;
    }

    private Integer toDurationSeconds(Provider provider, String key, Object raw) {
        boolean milliseconds = MILLISECOND_KEYS.contains(key);
        Long seconds = null;
        if (raw instanceof Number number) {
            seconds = milliseconds ? Math.round(number.doubleValue() / 1000.0) : Math.round(number.doubleValue());
        } else if (raw instanceof String s) {
            try {
                seconds = parseDurationText(s, milliseconds);
            } catch (NumberFormatException | ArithmeticException e) {
                log.warn("payload.value.discarded provider={} field=DURATION value={} reason=unparseable", provider, raw);
                return null;
            }
        }
        if (seconds == null) {
            return null;
        }
        if (seconds <= 0 || seconds > Integer.MAX_VALUE) {
            log.warn("payload.value.discarded provider={} field=DURATION value={} reason=out-of-range", provider, raw);
            return null;
        }
        return seconds.intValue();
    }

    private static Long parseDurationText(String text, boolean milliseconds) {
        Matcher clock = CLOCK_DURATION.matcher(text);
        if (clock.matches()) {
            long hours = clock.group(1) != null ? Long.parseLong(clock.group(1)) : 0;
            long minutes = Long.parseLong(clock.group(2));
            return Math.addExact(Math.addExact(Math.multiplyExact(hours, 3600L), Math.multiplyExact(minutes, 60L)),
                    Long.parseLong(clock.group(3)));
        }
        if (PLAIN_NUMBER.matcher(text).matches()) {
            double value = Double.parseDouble(text.trim());
            return milliseconds ? Math.round(value / 1000.0) : Math.round(value);
        }
        return null;
    }

    private void splitArtistTitle(ProviderPayload payload, SourceRecord.Builder builder) {
        Object rawTitle = payload.attribute("title");
        if (!(rawTitle instanceof String videoTitle)) {
            return;
        }
        int separator = videoTitle.indexOf(YOUTUBE_ARTIST_TITLE_SEPARATOR);
        if (separator <= 0) {
            return;
        }
        String artist = videoTitle.substring(0, separator).trim();
        String title = videoTitle.substring(separator + YOUTUBE_ARTIST_TITLE_SEPARATOR.length()).trim();
        if (artist.isEmpty() || title.isEmpty()) {
            return;
        }
        builder.artist(artist).title(title);
    }

    private static Map<MetadataField, List<String>> commonKeys() {
        EnumMap<MetadataField, List<String>> keys = new EnumMap<>(MetadataField.class);
        keys.put(MetadataField.TITLE, List.of("title"));
        keys.put(MetadataField.ARTIST, List.of("artist"));
        keys.put(MetadataField.ALBUM, List.of("album"));
        keys.put(MetadataField.YEAR, List.of("year", "release_date"));
        keys.put(MetadataField.GENRE, List.of("genre", "genres", "tags"));
        keys.put(MetadataField.DURATION, List.of("duration", "duration_ms"));
        keys.put(MetadataField.COVER_ART_URL, List.of("cover_art_url"));
        return Collections.unmodifiableMap(keys);
    }

    private static Map<Provider, Map<MetadataField, List<String>>> providerKeys() {
        EnumMap<Provider, Map<MetadataField, List<String>>> keys = new EnumMap<>(Provider.class);
        keys.put(Provider.MUSICBRAINZ, Map.of(
                MetadataField.YEAR, List.of("first_release_date"),
                MetadataField.DURATION, List.of("length")));
        keys.put(Provider.DISCOGS, Map.of(
                MetadataField.COVER_ART_URL, List.of("cover_image")));
        keys.put(Provider.SPOTIFY, Map.of(
                MetadataField.TITLE, List.of("name")));
        keys.put(Provider.LASTFM, Map.of(
                MetadataField.TITLE, List.of("name"),
                MetadataField.COVER_ART_URL, List.of("image")));
        keys.put(Provider.GENIUS, Map.of(
                MetadataField.ARTIST, List.of("primary_artist"),
                MetadataField.COVER_ART_URL, List.of("song_art_image_url")));
        keys.put(Provider.YOUTUBE, Map.of(
                MetadataField.ARTIST, List.of("channel"),
                MetadataField.YEAR, List.of("upload_date"),
                MetadataField.COVER_ART_URL, List.of("thumbnail")));
        return Collections.unmodifiableMap(keys);
    }
}
