package com.metadata.reconciliation.corroboration;

import com.metadata.reconciliation.core.model.MetadataField;
import com.metadata.reconciliation.core.model.Provider;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Which providers agree with at least one other provider on a field's value.
 *
 * @param field              the field compared
 * @param agreeingProviders  providers whose value another provider matches
 * @param bonus              score bonus granted to each agreeing provider
 */
public record FieldCorroboration(MetadataField field, Set<Provider> agreeingProviders, double bonus) {

    public FieldCorroboration {
        Objects.requireNonNull(field, "field is required");
        agreeingProviders = agreeingProviders == null || agreeingProviders.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Provider.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(agreeingProviders));
    }

    public static FieldCorroboration none(MetadataField field) {
        return new FieldCorroboration(field, Set.of(), 0.0);
    }

    /**
     * True when two or more distinct providers agree.
     */
    public boolean isCorroborated() {
        return agreeingProviders.size() >= 2;
    }

    public boolean isAgreeing(Provider provider) {
        return agreeingProviders.contains(provider);
    }

    /**
     * Adds the bonus for agreeing providers, capped at 1.0.
     */
    public double effectiveScore(Provider provider, double baseScore) {
        if (!isAgreeing(provider)) {
            return baseScore;
        }
        return Math.min(1.0, baseScore + bonus);
    }
}
