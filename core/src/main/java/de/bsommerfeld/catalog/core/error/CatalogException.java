package de.bsommerfeld.catalog.core.error;

/**
 * Root of the catalog's checked failures. Subclasses classify the failure
 * so callers (and the RPC layer) can react without parsing messages.
 */
public class CatalogException extends Exception {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
