package com.metadata.reconciliation.core.model;

import java.util.Objects;

/**
 * A user-directed override forcing one provider's value for one field.
 */
public record FieldPin(MetadataField field, Provider provider) {

    public FieldPin {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(provider, "provider is required");
    }

    public static FieldPin of(MetadataField field, Provider provider) {
        return new FieldPin(field, provider);
    }
}
