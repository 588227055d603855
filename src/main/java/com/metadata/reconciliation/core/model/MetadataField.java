package com.metadata.reconciliation.core.model;

/**
 * The universal field set every provider record is evaluated against.
 * Declaration order is the merge order.
 */
public enum MetadataField {
    TITLE("title", String.class),
    ARTIST("artist", String.class),
    ALBUM("album", String.class),
    YEAR("year", Integer.class),
    GENRE("genre", String.class),
    /** Track length in whole seconds. */
    DURATION("duration", Integer.class),
    COVER_ART_URL("cover_art_url", String.class);

    private final String key;
    private final Class<?> valueType;

    MetadataField(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    public boolean isNumeric() {
        return valueType == Integer.class;
    }

    /**
     * Size of the universal field set, used as the completeness denominator.
     */
    public static int count() {
        return values().length;
    }
}
