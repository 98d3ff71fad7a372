package de.bsommerfeld.catalog.core.error;

/**
 * Thrown when a package, channel or bundle is absent.
 */
public class NotFoundException extends CatalogException {

    public NotFoundException(String message) {
        super(message);
    }
}
