package com.metadata.reconciliation.core;

/**
 * Base class for errors raised by the reconciliation engine.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
