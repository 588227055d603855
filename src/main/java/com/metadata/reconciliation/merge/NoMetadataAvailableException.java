package com.metadata.reconciliation.merge;

import com.metadata.reconciliation.core.ReconciliationException;

/**
 * Thrown when a merge is requested with no usable source records.
 */
public class NoMetadataAvailableException extends ReconciliationException {

    public NoMetadataAvailableException() {
        super("No metadata available: every provider returned nothing usable");
    }

    public NoMetadataAvailableException(String message) {
        super(message);
    }
}
