package de.bsommerfeld.catalog.core.config;

/**
 * Error policy for operations over many independent items.
 */
public enum BatchMode {

    /** Log each failed item, continue, and report all failures at the end. */
    PERMISSIVE,

    /** Stop at the first failed item. Items already committed stay committed. */
    STRICT
}
