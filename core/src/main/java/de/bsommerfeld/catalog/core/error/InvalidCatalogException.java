package de.bsommerfeld.catalog.core.error;

/**
 * The declarative source catalog is malformed or inconsistent.
 */
public class InvalidCatalogException extends CatalogException {

    public InvalidCatalogException(String message) {
        super(message);
    }

    public InvalidCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
