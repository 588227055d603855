package com.metadata.reconciliation.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One provider's value for a field, with the score used to rank it.
 *
 * @param provider       the provider that supplied the value
 * @param value          the provider's literal value
 * @param effectiveScore overall record score plus any corroboration bonus, in [0,1]
 * @param agreeing       true if another provider's value for this field agrees with this one
 */
public record Candidate(Provider provider, Object value, double effectiveScore, boolean agreeing) {

    /**
     * Best first: effective score descending, then provider priority.
     */
    public static final Comparator<Candidate> RANKING =
            Comparator.comparingDouble(Candidate::effectiveScore).reversed()
                    .thenComparing(Candidate::provider, Provider.BY_PRIORITY);

    public Candidate {
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(value, "value is required");
        if (effectiveScore < 0.0 || effectiveScore > 1.0) {
            throw new IllegalArgumentException("Effective score must be between 0.0 and 1.0");
        }
    }
}
