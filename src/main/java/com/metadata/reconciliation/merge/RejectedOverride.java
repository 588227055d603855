package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.model.FieldPin;

import java.util.Objects;

/**
 * A field pin that could not be applied.
 *
 * @param pin    the requested pin
 * @param reason why the pinned provider cannot supply the field
 */
public record RejectedOverride(FieldPin pin, String reason) {

    public RejectedOverride {
        Objects.requireNonNull(pin, "pin is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
