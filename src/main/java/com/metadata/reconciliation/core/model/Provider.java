package com.metadata.reconciliation.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * External metadata providers known to the reconciliation engine.
 * The priority rank orders providers for tie-breaking only (lower rank = higher priority):
 * MusicBrainz, Discogs, Spotify, Last.fm, Genius, YouTube.
 */
public enum Provider {
    MUSICBRAINZ("MusicBrainz", 0, Set.of("musicbrainz", "mb")),
    YOUTUBE("YouTube", 5, Set.of("youtube", "yt")),
    DISCOGS("Discogs", 1, Set.of("discogs")),
    SPOTIFY("Spotify", 2, Set.of("spotify")),
    LASTFM("Last.fm", 3, Set.of("lastfm", "last.fm", "last_fm")),
    GENIUS("Genius", 4, Set.of("genius"));

    /**
     * Orders providers from highest to lowest priority.
     */
    public static final Comparator<Provider> BY_PRIORITY = Comparator.comparingInt(Provider::getPriorityRank);

    private final String displayName;
    private final int priorityRank;
    private final Set<String> tags;

    Provider(String displayName, int priorityRank, Set<String> tags) {
        this.displayName = displayName;
        this.priorityRank = priorityRank;
        this.tags = tags;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPriorityRank() {
        return priorityRank;
    }

    /**
     * Returns true if this provider wins a tie against the other provider.
     */
    public boolean outranks(Provider other) {
        return priorityRank < other.priorityRank;
    }

    /**
     * Resolves a provider from a payload tag such as "musicbrainz" or "Last.fm".
     * Matching is case-insensitive and also accepts the enum name.
     */
    public static Optional<Provider> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String key = tag.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.tags.contains(key) || provider.name().toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
