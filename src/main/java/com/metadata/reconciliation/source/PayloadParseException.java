package com.metadata.reconciliation.source;

import com.metadata.reconciliation.core.ReconciliationException;

/**
 * Thrown when provider payload JSON cannot be read.
 */
public class PayloadParseException extends ReconciliationException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
