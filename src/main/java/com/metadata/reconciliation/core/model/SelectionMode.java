package com.metadata.reconciliation.core.model;

/**
 * How a field's value was chosen.
 */
public enum SelectionMode {
    /**
     * Highest effective score, ties broken by provider priority.
     */
    AUTOMATIC,

    /**
     * Pinned by the caller to a specific provider.
     */
    OVERRIDE,

    /**
     * No provider supplied a value; the field is null.
     */
    NONE
}
