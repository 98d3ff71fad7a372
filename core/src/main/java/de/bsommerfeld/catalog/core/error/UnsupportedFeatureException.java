package de.bsommerfeld.catalog.core.error;

/**
 * An alpha feature was used while alpha features are disabled.
 */
public class UnsupportedFeatureException extends CatalogException {

    public UnsupportedFeatureException(String message) {
        super(message);
    }
}
