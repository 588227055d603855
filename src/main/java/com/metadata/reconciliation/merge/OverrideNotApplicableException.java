package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.ReconciliationException;

import java.util.List;

/**
 * Thrown when a caller asks for rejected field pins to be treated as an error.
 */
public class OverrideNotApplicableException extends ReconciliationException {
    private final List<RejectedOverride> rejected;

    public OverrideNotApplicableException(List<RejectedOverride> rejected) {
        super(describe(rejected));
        this.rejected = List.copyOf(rejected);
    }

    public List<RejectedOverride> getRejected() {
        return rejected;
    }

    private static String describe(List<RejectedOverride> rejected) {
        StringBuilder sb = new StringBuilder("Override not applicable:");
        for (RejectedOverride r : rejected) {
            sb.append(' ').append(r.pin().field().getKey())
                    .append("<-").append(r.pin().provider().getDisplayName())
                    .append(" (").append(r.reason()).append(')');
        }
        return sb.toString();
    }
}
