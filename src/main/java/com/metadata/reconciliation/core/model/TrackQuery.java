package com.metadata.reconciliation.core.model;

/**
 * The track the user searched for. Both parts are optional; query-sensitive
 * confidence rules treat a missing part as "no exact match possible".
 */
public record TrackQuery(String title, String artist) {

    public static TrackQuery of(String title, String artist) {
        return new TrackQuery(title, artist);
    }

    public static TrackQuery none() {
        return new TrackQuery(null, null);
    }

    public boolean hasTitleAndArtist() {
        return title != null && !title.isBlank() && artist != null && !artist.isBlank();
    }

    /**
     * Returns "artist title", skipping whichever part is absent.
     */
    public String asSearchString() {
        StringBuilder sb = new StringBuilder();
        if (artist != null && !artist.isBlank()) {
            sb.append(artist.trim());
        }
        if (title != null && !title.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(title.trim());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return asSearchString();
    }
}
