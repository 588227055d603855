package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.model.MergedMetadata;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying field pins. Rejected pins leave their field at its prior
 * selection and are listed here instead of failing the whole operation.
 */
public record OverrideResult(MergedMetadata merged, List<RejectedOverride> rejected) {

    public OverrideResult {
        Objects.requireNonNull(merged, "merged is required");
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * Returns the merged metadata, or throws if any pin was rejected.
     *
     * @throws OverrideNotApplicableException if at least one pin was rejected
     */
    public MergedMetadata throwIfRejected() {
        if (hasRejections()) {
            throw new OverrideNotApplicableException(rejected);
        }
        return merged;
    }
}
