package com.metadata.reconciliation.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The merge decision for a single field, with full provenance.
 *
 * @param field            the field
 * @param selectedValue    the winning provider's literal value, or null
 * @param winningProvider  the provider whose value was selected, or null
 * @param alternates       every candidate for this field, best first
 * @param corroborated     true if two or more providers agree on a value
 * @param selectionMode    how the value was chosen
 */
public record FieldResolution(
        MetadataField field,
        Object selectedValue,
        Provider winningProvider,
        List<Candidate> alternates,
        boolean corroborated,
        SelectionMode selectionMode
) {
    public FieldResolution {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(selectionMode, "selectionMode is required");
        alternates = alternates != null ? List.copyOf(alternates) : List.of();
        if ((selectedValue == null) != (winningProvider == null)) {
            throw new IllegalArgumentException("selectedValue and winningProvider must both be set or both be null");
        }
    }

    /**
     * A field no provider supplied.
     */
    public static FieldResolution empty(MetadataField field) {
        return new FieldResolution(field, null, null, List.of(), false, SelectionMode.NONE);
    }

    public boolean hasValue() {
        return selectedValue != null;
    }

    /**
     * The candidate backing the selected value.
     */
    public Optional<Candidate> selectedCandidate() {
        if (winningProvider == null) {
            return Optional.empty();
        }
        return alternates.stream()
                .filter(c -> c.provider() == winningProvider)
                .findFirst();
    }

    /**
     * Effective score of the selected candidate, or empty for a null field.
     */
    public Optional<Double> selectedScore() {
        return selectedCandidate().map(Candidate::effectiveScore);
    }

    public Optional<Candidate> candidateFrom(Provider provider) {
        return alternates.stream()
                .filter(c -> c.provider() == provider)
                .findFirst();
    }
}
