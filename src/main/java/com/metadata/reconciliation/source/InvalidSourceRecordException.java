package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.ReconciliationException;

/**
 * Thrown when a provider payload cannot become a source record,
 * typically because its provider tag is missing or unknown.
 * Batch normalization drops such payloads instead of propagating this.
 */
public class InvalidSourceRecordException extends ReconciliationException {

    private final String providerTag;

    public InvalidSourceRecordException(String providerTag, String message) {
        super(message);
        this.providerTag = providerTag;
    }

    /**
     * The tag the payload carried, or null if it had none.
     */
    public String getProviderTag() {
        return providerTag;
    }
}
